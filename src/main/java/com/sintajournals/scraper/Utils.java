package com.sintajournals.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.Callable;

/**
 * Utility class for common helper methods used in crawling and file operations.
 *
 * @author SINTA Journals Scraper Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter DATE_PARTITION = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    /**
     * Formats a timestamp for use in artifact file names, e.g. {@code 20250104_153012}.
     */
    public static String fileTimestamp(LocalDateTime time) {
        return FILE_TIMESTAMP.format(time);
    }

    /**
     * Builds the date-partitioned remote directory {@code <root>/<YYYY>/<MM>/<DD>}.
     * @param root configured remote root; a trailing slash is ignored
     * @param time run timestamp
     */
    public static String datePartition(String root, LocalDateTime time) {
        String base = root == null ? "" : root.trim();
        while (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return base + "/" + DATE_PARTITION.format(time);
    }

    /**
     * Retries a browser action up to maxRetries times with exponential backoff.
     * @param action Callable action to execute
     * @param maxRetries Maximum number of retries
     * @param actionDesc Description for logging
     * @param <T> Return type
     * @return Result of action, or null if all retries fail
     */
    public static <T> T retryRendererAction(Callable<T> action, int maxRetries, String actionDesc) {
        int attempts = 0;
        while (attempts < maxRetries) {
            try {
                return action.call();
            } catch (Exception e) {
                logger.warn("Failed {} (attempt {}): {}", actionDesc, attempts + 1, e.getMessage());
                attempts++;
                if (attempts >= maxRetries) break;
                try {
                    Thread.sleep((long) Math.pow(2, attempts) * 1000); // Exponential backoff
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while retrying {}", actionDesc);
                    return null;
                }
            }
        }
        logger.error("Giving up on {} after {} attempts.", actionDesc, maxRetries);
        return null;
    }
}
