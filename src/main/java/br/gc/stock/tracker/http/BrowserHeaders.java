package br.gc.stock.tracker.http;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Request headers that look like a regular browser visit. The user agent rotates on every call.
 */
final class BrowserHeaders {

    private static final List<String> USER_AGENTS = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/126.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/16.3 Safari/605.1.15",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:109.0) Gecko/20100101 Firefox/113.0",
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/125.0.0.0 Safari/537.36"
    );

    private static final AtomicInteger NEXT = new AtomicInteger();

    private BrowserHeaders() {
    }

    static String nextUserAgent() {
        return USER_AGENTS.get(Math.floorMod(NEXT.getAndIncrement(), USER_AGENTS.size()));
    }

    /**
     * Headers for a page navigation (HTML or XML documents).
     */
    static HttpHeaders page(String referer) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, nextUserAgent());
        headers.set(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8");
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.5");
        headers.set(HttpHeaders.CACHE_CONTROL, "max-age=0");
        headers.set("Upgrade-Insecure-Requests", "1");
        if (referer != null) {
            headers.set(HttpHeaders.REFERER, referer);
        }
        return headers;
    }

    /**
     * Headers for a same-origin XHR form post, as sent by the site's own quote pages.
     */
    static HttpHeaders ajaxForm(String referer, String origin) {
        HttpHeaders headers = page(referer);
        headers.set(HttpHeaders.ACCEPT, "application/json, text/javascript, */*; q=0.01");
        headers.setContentType(new MediaType(MediaType.APPLICATION_FORM_URLENCODED, StandardCharsets.UTF_8));
        headers.set(HttpHeaders.ORIGIN, origin);
        headers.set("X-Requested-With", "XMLHttpRequest");
        headers.set("Sec-Fetch-Dest", "empty");
        headers.set("Sec-Fetch-Mode", "cors");
        headers.set("Sec-Fetch-Site", "same-origin");
        headers.remove("Upgrade-Insecure-Requests");
        return headers;
    }
}
