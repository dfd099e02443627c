package org.sjsu.botworker.service.bot;

/**
 * The page a browser bot is currently on, as last reported by the request handler.
 */
public interface PageContext {

    String getPath();

    String getHtml();
}
