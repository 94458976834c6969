package com.sintajournals.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitForSelectorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link PageRendererInterface} backed by a Playwright Chromium page.
 * <p>
 * Clicks are dispatched through the DOM ({@code el.click()}) after scrolling the element into
 * view, which is more reliable than pointer clicks on the portal's modal and pagination
 * controls. Navigation is retried with backoff before giving up.
 *
 * @author SINTA Journals Scraper Team
 * @since 1.0
 */
public class PlaywrightPageRenderer implements PageRendererInterface {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightPageRenderer.class);
    private static final int NAVIGATION_ATTEMPTS = 3;
    private static final double DEFAULT_TIMEOUT_MS = 30_000;

    private static final String ATTRIBUTES_SCRIPT =
        "el => { const out = {};"
        + " for (const a of el.attributes) { out[a.name] = a.value; }"
        + " out.checked = String(!!el.checked);"
        + " out.text = (el.innerText || el.textContent || '').trim();"
        + " return out; }";

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;

    public PlaywrightPageRenderer(boolean headless) {
        try {
            this.playwright = Playwright.create();
        } catch (PlaywrightException e) {
            logger.error("Failed to start Playwright: {}", e.getMessage());
            throw new RendererException("Failed to start Playwright", e);
        }
        try {
            this.browser = playwright.chromium().launch(getDefaultLaunchOptions(headless));
            this.context = browser.newContext(new Browser.NewContextOptions().setViewportSize(1920, 1080));
            this.page = context.newPage();
            page.setDefaultTimeout(DEFAULT_TIMEOUT_MS);
            page.setDefaultNavigationTimeout(DEFAULT_TIMEOUT_MS);
            logger.info("Chromium launched (headless={}).", headless);
        } catch (PlaywrightException e) {
            logger.error("Failed to launch browser: {}", e.getMessage());
            playwright.close();
            throw new RendererException("Failed to launch browser", e);
        }
    }

    private static BrowserType.LaunchOptions getDefaultLaunchOptions(boolean headless) {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions();
        options.setHeadless(headless);
        options.setArgs(Arrays.asList(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-notifications",
            "--disable-infobars",
            "--disable-extensions",
            "--window-size=1920,1080"
        ));
        return options;
    }

    @Override
    public void navigate(String url) {
        Boolean ok = Utils.retryRendererAction(() -> { page.navigate(url); return true; }, NAVIGATION_ATTEMPTS, "navigate to " + url);
        if (ok == null) {
            throw new RendererException("Could not navigate to " + url);
        }
        logger.info("Navigated to {}", page.url());
    }

    @Override
    public boolean waitForElement(String selector, Duration timeout) {
        try {
            page.waitForSelector(selector, new Page.WaitForSelectorOptions()
                .setState(WaitForSelectorState.ATTACHED)
                .setTimeout(timeout.toMillis()));
            logger.debug("Waited for selector: {} ({}ms)", selector, timeout.toMillis());
            return true;
        } catch (TimeoutError e) {
            logger.warn("Timeout waiting for selector '{}' after {}ms", selector, timeout.toMillis());
            return false;
        } catch (PlaywrightException e) {
            throw new RendererException("Failed waiting for selector " + selector, e);
        }
    }

    @Override
    public void click(ElementRef element) {
        try {
            Locator locator = page.locator(element.selector()).first();
            locator.scrollIntoViewIfNeeded();
            locator.evaluate("el => el.click()");
            logger.debug("Successfully clicked: {}", element.selector());
        } catch (PlaywrightException e) {
            throw new RendererException("Failed to click " + element.selector(), e);
        }
    }

    @Override
    public String currentMarkup() {
        try {
            return page.content();
        } catch (PlaywrightException e) {
            throw new RendererException("Failed to read page content", e);
        }
    }

    @Override
    public Optional<ElementRef> findElement(String selector) {
        try {
            return page.locator(selector).count() > 0 ? Optional.of(new ElementRef(selector)) : Optional.empty();
        } catch (PlaywrightException e) {
            throw new RendererException("Failed to query selector " + selector, e);
        }
    }

    @Override
    public Map<String, String> elementAttributes(ElementRef element) {
        try {
            Object raw = page.locator(element.selector()).first().evaluate(ATTRIBUTES_SCRIPT);
            Map<String, String> attributes = new LinkedHashMap<>();
            if (raw instanceof Map) {
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
                    attributes.put(String.valueOf(entry.getKey()), entry.getValue() == null ? "" : String.valueOf(entry.getValue()));
                }
            }
            return attributes;
        } catch (PlaywrightException e) {
            throw new RendererException("Failed to read attributes of " + element.selector(), e);
        }
    }

    @Override
    public boolean saveScreenshot(Path path) {
        try {
            if (path.getParent() != null) Files.createDirectories(path.getParent());
            page.screenshot(new Page.ScreenshotOptions().setPath(path).setFullPage(true));
            return true;
        } catch (Exception e) {
            logger.warn("Failed to save screenshot {}: {}", path, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
        } catch (PlaywrightException e) {
            logger.warn("Failed to close browser cleanly: {}", e.getMessage());
        } finally {
            playwright.close();
        }
    }
}
