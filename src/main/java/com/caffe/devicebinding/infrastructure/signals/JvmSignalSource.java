package com.caffe.devicebinding.infrastructure.signals;

import com.caffe.devicebinding.domain.fingerprint.SignalSet;
import com.caffe.devicebinding.domain.fingerprint.SignalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.AWTError;
import java.awt.Color;
import java.awt.DisplayMode;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.GraphicsEnvironment;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.Security;
import java.time.ZoneId;
import java.util.Base64;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Signal source for desktop JVM clients. Screen metrics come from AWT, the raster is
 * drawn on an off-screen image that is discarded afterwards. Headless or font-less
 * environments simply report {@link SignalSet#UNKNOWN} for the affected fields.
 */
public class JvmSignalSource implements SignalSource {

    private static final Logger log = LoggerFactory.getLogger(JvmSignalSource.class);

    static final int RASTER_WIDTH = 200;
    static final int RASTER_HEIGHT = 50;
    static final String RASTER_TEXT = "CAFFE Observer Platform";
    static final Color RASTER_ACCENT = new Color(0xFF, 0xBD, 0x00);

    @Override
    public SignalSet collect() {
        DisplayMode display = signal("display", JvmSignalSource::displayMode);
        return new SignalSet(
                display == null ? null : display.getWidth() + "x" + display.getHeight(),
                display == null || display.getBitDepth() == DisplayMode.BIT_DEPTH_MULTI
                        ? null : String.valueOf(display.getBitDepth()),
                signal("timezone", () -> ZoneId.systemDefault().getId()),
                signal("language", () -> Locale.getDefault().toLanguageTag()),
                signal("platform", () -> System.getProperty("os.name") + " " + System.getProperty("os.arch")),
                signal("processors", () -> String.valueOf(Runtime.getRuntime().availableProcessors())),
                signal("capabilities", () -> String.valueOf(Security.getProviders().length)),
                signal("raster", JvmSignalSource::renderRaster),
                signal("userAgent", JvmSignalSource::userAgent));
    }

    private static DisplayMode displayMode() {
        if (GraphicsEnvironment.isHeadless()) {
            return null;
        }
        return GraphicsEnvironment.getLocalGraphicsEnvironment().getDefaultScreenDevice().getDisplayMode();
    }

    static String renderRaster() {
        BufferedImage image = new BufferedImage(RASTER_WIDTH, RASTER_HEIGHT, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setFont(new Font("Arial", Font.PLAIN, 14));
            g.setColor(Color.BLACK);
            g.drawString(RASTER_TEXT, 2, 16);
            g.setColor(RASTER_ACCENT);
            g.fillRect(100, 25, 80, 15);
        } finally {
            g.dispose();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", out)) {
                return null;
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return "data:image/png;base64," + Base64.getEncoder().encodeToString(out.toByteArray());
    }

    private static String userAgent() {
        return "Java/" + System.getProperty("java.version")
                + " (" + System.getProperty("java.vm.name") + "; " + System.getProperty("java.vendor") + ")";
    }

    private static <T> T signal(String name, Supplier<T> reader) {
        try {
            return reader.get();
        } catch (RuntimeException | LinkageError | AWTError | InternalError e) {
            // e.g. no display, no fontconfig, missing native libraries
            log.debug("Signal '{}' unavailable: {}", name, e.toString());
            return null;
        }
    }
}
