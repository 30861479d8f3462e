package com.example.platformauth.adapter.browser;

/**
 * Receives events of one browsing context, always on that context's own event thread.
 */
public interface BrowsingContextListener {

  /**
   * The main frame committed a navigation to {@code url}.
   */
  void onNavigated(BrowsingContext context, String url);

  /**
   * The window is gone, whether closed by the user or by {@link BrowsingContext#close()}.
   * Called exactly once.
   */
  void onClosed(BrowsingContext context);
}
