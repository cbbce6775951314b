package com.personal.image_converter;

import com.personal.image_converter.config.ConverterConfig;
import com.personal.image_converter.tools.ImageFormatConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.JOptionPane;
import javax.swing.SwingUtilities;

/**
 * Desktop entry point: loads the configuration and opens the converter window.
 */
public final class ImageConverterApp {

    private static final Logger log = LoggerFactory.getLogger(ImageConverterApp.class);

    private ImageConverterApp() {}

    public static void main(String[] args) {
        ConverterConfig config = ConverterConfig.load(ConverterConfig.DEFAULT_CONFIG_FILE);
        log.info("Starting Image Converter with {}", config);

        SwingUtilities.invokeLater(() -> {
            try {
                ConverterFrame frame = new ConverterFrame(new ImageFormatConverter(), config);
                frame.setLocationRelativeTo(null);
                frame.setVisible(true);
            } catch (RuntimeException e) {
                log.error("Application error", e);
                JOptionPane.showMessageDialog(null, "An error occurred: " + e.getMessage(),
                        "Application Error", JOptionPane.ERROR_MESSAGE);
            }
        });
    }
}
