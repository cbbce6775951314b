package com.personal.image_converter;

import com.personal.image_converter.config.ConverterConfig;
import com.personal.image_converter.tools.BatchSummary;
import com.personal.image_converter.tools.ConversionListener;
import com.personal.image_converter.tools.ConversionMessage;
import com.personal.image_converter.tools.ConversionQueuePoller;
import com.personal.image_converter.tools.ConversionSettings;
import com.personal.image_converter.tools.ConversionWorker;
import com.personal.image_converter.tools.FileFailure;
import com.personal.image_converter.tools.ImageFileClassifier;
import com.personal.image_converter.tools.ImageFormatConverterInterface;
import com.personal.image_converter.tools.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.BorderFactory;
import javax.swing.DefaultListModel;
import javax.swing.JButton;
import javax.swing.JCheckBox;
import javax.swing.JComboBox;
import javax.swing.JFileChooser;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JList;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.JProgressBar;
import javax.swing.JScrollPane;
import javax.swing.JSpinner;
import javax.swing.SpinnerNumberModel;
import javax.swing.Timer;
import javax.swing.WindowConstants;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.BorderLayout;
import java.awt.FlowLayout;
import java.awt.GridLayout;
import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.stream.Collectors;

/**
 * Main window. Collects the file list and options, starts a
 * {@link ConversionWorker}, and renders its messages. Owns no conversion logic.
 */
class ConverterFrame extends JFrame implements ConversionListener {

    private static final Logger log = LoggerFactory.getLogger(ConverterFrame.class);
    private static final String SAME_AS_INPUT = "Same as input";

    private final ImageFormatConverterInterface converter;
    private final BlockingQueue<ConversionMessage> queue = new LinkedBlockingQueue<>();
    private final ConversionQueuePoller poller = new ConversionQueuePoller(queue, this);
    private final Timer pollTimer;

    private final DefaultListModel<Path> fileListModel = new DefaultListModel<>();
    private final JComboBox<OutputFormat> formatBox = new JComboBox<>(OutputFormat.values());
    private final JCheckBox resizeBox = new JCheckBox("Resize to fit");
    private final JSpinner widthSpinner;
    private final JSpinner heightSpinner;
    private final JCheckBox qualityBox = new JCheckBox("Quality");
    private final JSpinner qualitySpinner;
    private final JLabel outputFolderLabel = new JLabel(SAME_AS_INPUT);
    private final JProgressBar progressBar = new JProgressBar(0, 1000);
    private final JLabel statusLabel = new JLabel("Ready");
    private final JButton convertButton = new JButton("Start Conversion");
    private final JButton cancelButton = new JButton("Cancel");

    private Path outputFolder;
    private ConversionWorker worker;

    ConverterFrame(ImageFormatConverterInterface converter, ConverterConfig config) {
        super("Image Converter");
        this.converter = converter;

        widthSpinner = new JSpinner(new SpinnerNumberModel(config.getDefaultResizeWidth(),
                ConversionSettings.MIN_DIMENSION, ConversionSettings.MAX_DIMENSION, 1));
        heightSpinner = new JSpinner(new SpinnerNumberModel(config.getDefaultResizeHeight(),
                ConversionSettings.MIN_DIMENSION, ConversionSettings.MAX_DIMENSION, 1));
        qualitySpinner = new JSpinner(new SpinnerNumberModel(config.getDefaultQuality(), 1, 100, 1));
        formatBox.setSelectedItem(config.getDefaultOutputFormat());

        setDefaultCloseOperation(WindowConstants.EXIT_ON_CLOSE);
        setLayout(new BorderLayout(8, 8));
        add(buildFilePanel(), BorderLayout.CENTER);
        add(buildOptionsPanel(), BorderLayout.EAST);
        add(buildProgressPanel(), BorderLayout.SOUTH);
        pack();

        pollTimer = new Timer((int) config.getQueuePollIntervalMillis(), e -> poller.drain());
        pollTimer.start();
    }

    private JPanel buildFilePanel() {
        JPanel panel = new JPanel(new BorderLayout(4, 4));
        panel.setBorder(BorderFactory.createTitledBorder("Files"));
        panel.add(new JScrollPane(new JList<>(fileListModel)), BorderLayout.CENTER);

        JButton addButton = new JButton("Add Files...");
        addButton.addActionListener(e -> chooseFiles());
        JButton clearButton = new JButton("Clear");
        clearButton.addActionListener(e -> fileListModel.clear());

        JPanel buttons = new JPanel(new FlowLayout(FlowLayout.LEFT));
        buttons.add(addButton);
        buttons.add(clearButton);
        panel.add(buttons, BorderLayout.SOUTH);
        return panel;
    }

    private JPanel buildOptionsPanel() {
        JPanel panel = new JPanel(new GridLayout(0, 2, 4, 4));
        panel.setBorder(BorderFactory.createTitledBorder("Options"));
        panel.add(new JLabel("Output format"));
        panel.add(formatBox);
        panel.add(resizeBox);
        panel.add(new JLabel());
        panel.add(new JLabel("Width"));
        panel.add(widthSpinner);
        panel.add(new JLabel("Height"));
        panel.add(heightSpinner);
        panel.add(qualityBox);
        panel.add(qualitySpinner);

        JButton folderButton = new JButton("Output Folder...");
        folderButton.addActionListener(e -> chooseOutputFolder());
        panel.add(folderButton);
        panel.add(outputFolderLabel);
        return panel;
    }

    private JPanel buildProgressPanel() {
        JPanel panel = new JPanel(new BorderLayout(4, 4));
        panel.setBorder(BorderFactory.createEmptyBorder(4, 8, 8, 8));
        panel.add(statusLabel, BorderLayout.NORTH);
        panel.add(progressBar, BorderLayout.CENTER);

        convertButton.addActionListener(e -> startConversion());
        cancelButton.addActionListener(e -> cancelConversion());
        cancelButton.setEnabled(false);
        JPanel buttons = new JPanel(new FlowLayout(FlowLayout.RIGHT));
        buttons.add(cancelButton);
        buttons.add(convertButton);
        panel.add(buttons, BorderLayout.SOUTH);
        return panel;
    }

    private void chooseFiles() {
        JFileChooser chooser = new JFileChooser();
        chooser.setMultiSelectionEnabled(true);
        chooser.setFileFilter(new FileNameExtensionFilter("Image files",
                ImageFileClassifier.IMAGE_EXTENSIONS.toArray(new String[0])));
        if (chooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        List<Path> selected = Arrays.stream(chooser.getSelectedFiles())
                .map(File::toPath)
                .collect(Collectors.toList());
        for (Path path : ImageFileClassifier.filterImageFiles(selected)) {
            if (!fileListModel.contains(path)) {
                fileListModel.addElement(path);
            }
        }
        statusLabel.setText(fileListModel.size() + " file(s) selected");
    }

    private void chooseOutputFolder() {
        JFileChooser chooser = new JFileChooser();
        chooser.setFileSelectionMode(JFileChooser.DIRECTORIES_ONLY);
        if (chooser.showOpenDialog(this) == JFileChooser.APPROVE_OPTION) {
            outputFolder = chooser.getSelectedFile().toPath();
            outputFolderLabel.setText(outputFolder.toString());
        }
    }

    private ConversionSettings currentSettings() {
        ConversionSettings.Builder builder = ConversionSettings.builder()
                .outputFormat((OutputFormat) formatBox.getSelectedItem())
                .outputFolder(outputFolder)
                .resize(resizeBox.isSelected());
        if (resizeBox.isSelected()) {
            builder.resizeTarget((Integer) widthSpinner.getValue(), (Integer) heightSpinner.getValue());
        }
        if (qualityBox.isSelected()) {
            builder.quality((Integer) qualitySpinner.getValue());
        }
        return builder.build();
    }

    private void startConversion() {
        if (fileListModel.isEmpty()) {
            JOptionPane.showMessageDialog(this, "Please select files to convert first.",
                    "No Files", JOptionPane.WARNING_MESSAGE);
            return;
        }
        List<Path> files = new ArrayList<>(fileListModel.size());
        for (int i = 0; i < fileListModel.size(); i++) {
            files.add(fileListModel.get(i));
        }
        worker = new ConversionWorker(converter, files, currentSettings(), queue);
        setRunning(true);
        worker.start();
    }

    private void cancelConversion() {
        if (worker != null) {
            worker.cancel();
            statusLabel.setText("Cancelling after the current file...");
        }
    }

    private void setRunning(boolean running) {
        convertButton.setEnabled(!running);
        convertButton.setText(running ? "Converting..." : "Start Conversion");
        cancelButton.setEnabled(running);
    }

    @Override
    public void onProgress(double fraction, String status) {
        progressBar.setValue((int) Math.round(fraction * progressBar.getMaximum()));
        statusLabel.setText(status);
    }

    @Override
    public void onComplete(BatchSummary summary) {
        setRunning(false);
        progressBar.setValue(progressBar.getMaximum());
        statusLabel.setText(String.format(Locale.ROOT, "Conversion complete: %d/%d successful in %.1f s",
                summary.getSuccessfulCount(), summary.getTotalFiles(),
                summary.getElapsed().toMillis() / 1000.0));
        if (summary.hasFailures()) {
            JOptionPane.showMessageDialog(this,
                    "Successfully converted: " + summary.getSuccessfulCount()
                            + String.format(Locale.ROOT, " (%.0f%%)", summary.getSuccessRate())
                            + "\nFailed: " + summary.getFailedCount()
                            + "\n\nFailed files:\n" + describeFailures(summary.getFailures()),
                    "Conversion Complete with Errors", JOptionPane.WARNING_MESSAGE);
        } else {
            JOptionPane.showMessageDialog(this,
                    "Successfully converted all " + summary.getSuccessfulCount() + " images!",
                    "Conversion Complete", JOptionPane.INFORMATION_MESSAGE);
        }
    }

    @Override
    public void onCancelled(BatchSummary summary) {
        setRunning(false);
        statusLabel.setText("Cancelled: " + summary.getSuccessfulCount() + " converted, "
                + (summary.getTotalFiles() - summary.getProcessedFiles()) + " skipped");
    }

    @Override
    public void onError(String errorText) {
        setRunning(false);
        log.error("Batch failed: {}", errorText);
        JOptionPane.showMessageDialog(this, "An error occurred during conversion:\n" + errorText,
                "Conversion Error", JOptionPane.ERROR_MESSAGE);
    }

    private static String describeFailures(List<FileFailure> failures) {
        return failures.stream()
                .map(f -> f.getFileName() + " - " + f.getKind().getDescription())
                .collect(Collectors.joining("\n"));
    }

    @Override
    public void dispose() {
        pollTimer.stop();
        super.dispose();
    }
}
