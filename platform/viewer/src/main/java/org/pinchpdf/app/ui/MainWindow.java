package org.pinchpdf.app.ui;

import org.pinchpdf.app.di.ViewerComponent;
import org.pinchpdf.app.document.PdfFileChooser;
import org.pinchpdf.app.gesture.PanGestureDetector;
import org.pinchpdf.app.gesture.PinchZoomGestureListener;
import org.pinchpdf.app.gesture.ScaleGestureDetector;
import org.pinchpdf.app.preferences.ViewerPrefsSnapshot;
import org.pinchpdf.app.reader.PageImageView;
import org.pinchpdf.app.reader.VectorPdfView;
import org.pinchpdf.app.viewmodel.PdfViewModel;
import org.pinchpdf.core.PdfPageHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.BorderLayout;
import java.awt.CardLayout;
import java.awt.Color;
import java.awt.FlowLayout;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.File;
import java.util.Locale;

import javax.swing.JButton;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.JProgressBar;
import javax.swing.JToggleButton;
import javax.swing.Timer;
import javax.swing.WindowConstants;

/**
 * Main viewer window: wires the buttons to the view model and renders its state.
 */
public class MainWindow extends JFrame {
    private static final Logger LOG = LoggerFactory.getLogger(MainWindow.class);

    private static final String CARD_BITMAP = "bitmap";
    private static final String CARD_VECTOR = "vector";
    private static final float ZOOM_STEP = 0.5f;
    private static final int STATUS_TIMEOUT_MS = 3000;

    private final PdfViewModel pdfViewModel;
    private final PinchZoomGestureListener pinchZoomListener;
    private final PdfFileChooser fileChooser;
    private final WindowResources resources;

    private final PageImageView pdfImageView = new PageImageView();
    private final VectorPdfView vectorPdfView;
    private final CardLayout cards = new CardLayout();
    private final JPanel pageContainer = new JPanel(cards);

    private final JButton openPdfButton = new JButton("Open PDF");
    private final JButton previousPageButton = new JButton("Previous");
    private final JButton nextPageButton = new JButton("Next");
    private final JButton zoomOutButton = new JButton("Zoom out");
    private final JButton zoomInButton = new JButton("Zoom in");
    private final JButton resetZoomButton = new JButton("Reset zoom");
    private final JToggleButton vectorZoomToggle = new JToggleButton("Vector zoom");
    private final JLabel pageIndicator = new JLabel();
    private final JLabel zoomIndicator = new JLabel();
    private final JLabel errorTextView = new JLabel();
    private final JLabel statusLabel = new JLabel();
    private final JProgressBar loadingIndicator = new JProgressBar();
    private final Timer statusTimer;

    public MainWindow(ViewerComponent component) {
        super("PinchPDF");
        this.pdfViewModel = component.viewModel();
        this.pinchZoomListener = component.pinchZoomListener();
        ViewerPrefsSnapshot prefs = component.prefs();
        this.fileChooser = new PdfFileChooser(component.prefsStore(), prefs.lastDirectory);
        this.vectorPdfView = new VectorPdfView(component.renderTimer(), prefs.renderDebounceMs,
                prefs.viewportMinZoom, prefs.viewportMaxZoom);
        this.resources = new WindowResources(pdfViewModel, vectorPdfView, component.renderTimer());
        this.statusTimer = new Timer(STATUS_TIMEOUT_MS, e -> statusLabel.setText(""));
        this.statusTimer.setRepeats(false);

        buildLayout();
        setupUIListeners();
        observeViewModel();

        if (prefs.startInVectorMode) {
            vectorZoomToggle.setSelected(true);
            showVectorView(true);
        }
    }

    public void openFile(File file) {
        pdfViewModel.openPdf(file);
    }

    private void buildLayout() {
        setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
        setLayout(new BorderLayout());

        JPanel toolbar = new JPanel(new FlowLayout(FlowLayout.LEFT));
        toolbar.add(openPdfButton);
        toolbar.add(previousPageButton);
        toolbar.add(nextPageButton);
        toolbar.add(zoomOutButton);
        toolbar.add(zoomInButton);
        toolbar.add(resetZoomButton);
        toolbar.add(vectorZoomToggle);
        add(toolbar, BorderLayout.NORTH);

        pageContainer.add(pdfImageView, CARD_BITMAP);
        pageContainer.add(vectorPdfView, CARD_VECTOR);
        add(pageContainer, BorderLayout.CENTER);

        loadingIndicator.setIndeterminate(true);
        loadingIndicator.setVisible(false);
        errorTextView.setForeground(Color.RED);
        errorTextView.setVisible(false);

        JPanel statusBar = new JPanel(new FlowLayout(FlowLayout.LEFT));
        statusBar.add(pageIndicator);
        statusBar.add(zoomIndicator);
        statusBar.add(loadingIndicator);
        statusBar.add(errorTextView);
        statusBar.add(statusLabel);
        add(statusBar, BorderLayout.SOUTH);

        pack();
        setLocationByPlatform(true);
    }

    private void setupUIListeners() {
        openPdfButton.addActionListener(e -> {
            File file = fileChooser.choose(this);
            if (file != null) loadPdf(file);
        });
        nextPageButton.addActionListener(e -> pdfViewModel.nextPage());
        previousPageButton.addActionListener(e -> pdfViewModel.previousPage());
        resetZoomButton.addActionListener(e -> pdfViewModel.resetZoom());
        zoomInButton.addActionListener(e -> pdfViewModel.setZoomLevel(currentZoom() + ZOOM_STEP));
        zoomOutButton.addActionListener(e ->
                pdfViewModel.setZoomLevel(Math.max(currentZoom() - ZOOM_STEP, PdfViewModel.MIN_ZOOM)));
        vectorZoomToggle.addActionListener(e -> showVectorView(vectorZoomToggle.isSelected()));

        ScaleGestureDetector scaleGestureDetector = new ScaleGestureDetector(pinchZoomListener);
        PanGestureDetector panDetector = new PanGestureDetector(new PanGestureDetector.OnGestureListener() {
            @Override
            public boolean onScroll(float distanceX, float distanceY) {
                float fit = pdfImageView.fitScale();
                pdfViewModel.updateScroll(currentScrollX() + distanceX / fit, currentScrollY() + distanceY / fit);
                return true;
            }

            @Override
            public boolean onDoubleTap(float x, float y) {
                pdfViewModel.resetZoom();
                return true;
            }
        });
        pdfImageView.addMouseListener(panDetector);
        pdfImageView.addMouseMotionListener(panDetector);
        pdfImageView.addMouseWheelListener(e -> {
            if (!scaleGestureDetector.onMouseWheel(e)) panDetector.mouseWheelMoved(e);
        });

        addWindowListener(new WindowAdapter() {
            @Override
            public void windowClosed(WindowEvent e) {
                onDestroy();
            }
        });
    }

    private void observeViewModel() {
        resources.track(pdfViewModel.getCurrentPageBitmap().observe(bitmap -> {
            if (bitmap != null) {
                pdfImageView.setImageBitmap(bitmap);
                updateImageViewScale();
            }
        }));
        resources.track(pdfViewModel.getCurrentPage().observe(pageIndex -> {
            updatePageIndicator();
            if (vectorZoomToggle.isSelected()) showViewportPage();
        }));
        resources.track(pdfViewModel.getTotalPages().observe(total -> updatePageIndicator()));
        resources.track(pdfViewModel.getZoomLevel().observe(zoom -> {
            zoomIndicator.setText(String.format(Locale.ROOT, "Zoom: %.1fx", zoom != null ? zoom : 1f));
            updateImageViewScale();
        }));
        resources.track(pdfViewModel.getScrollX().observe(x -> updateImageViewScale()));
        resources.track(pdfViewModel.getScrollY().observe(y -> updateImageViewScale()));
        resources.track(pdfViewModel.getIsLoading().observe(loading ->
                loadingIndicator.setVisible(Boolean.TRUE.equals(loading))));
        resources.track(pdfViewModel.getError().observe(errorMessage -> {
            if (errorMessage != null) {
                showError(errorMessage);
                errorTextView.setText(errorMessage);
                errorTextView.setVisible(true);
            } else {
                errorTextView.setVisible(false);
            }
        }));
    }

    private void updatePageIndicator() {
        Integer page = pdfViewModel.getCurrentPage().getValue();
        Integer total = pdfViewModel.getTotalPages().getValue();
        pageIndicator.setText(PageIndicator.format(page, total));
    }

    private void updateImageViewScale() {
        pdfImageView.setZoom(currentZoom());
        pdfImageView.setScroll(currentScrollX(), currentScrollY());
    }

    private void showVectorView(boolean vector) {
        if (vector) {
            cards.show(pageContainer, CARD_VECTOR);
            showViewportPage();
        } else {
            vectorPdfView.release();
            cards.show(pageContainer, CARD_BITMAP);
        }
    }

    private void showViewportPage() {
        if (!pdfViewModel.hasDocument()) return;
        try {
            PdfPageHandle page = pdfViewModel.openViewportPage();
            if (page != null) vectorPdfView.showPage(page);
        } catch (RuntimeException e) {
            LOG.error("Failed to open page for vector zoom", e);
            showError("Failed to open page: " + e.getMessage());
        }
    }

    private void loadPdf(File file) {
        if (!file.isFile() || !file.canRead()) {
            showError("Failed to open PDF file");
            return;
        }
        vectorPdfView.release();
        pdfViewModel.openPdf(file);
    }

    private void showError(String message) {
        statusLabel.setText(message);
        statusTimer.restart();
    }

    private float currentZoom() {
        Float zoom = pdfViewModel.getZoomLevel().getValue();
        return zoom != null ? zoom : 1f;
    }

    private float currentScrollX() {
        Float x = pdfViewModel.getScrollX().getValue();
        return x != null ? x : 0f;
    }

    private float currentScrollY() {
        Float y = pdfViewModel.getScrollY().getValue();
        return y != null ? y : 0f;
    }

    private void onDestroy() {
        statusTimer.stop();
        resources.release();
    }
}
