package com.example.platformauth.adapter.browser;

import com.example.platformauth.domain.entity.BrowserCookie;
import java.util.List;

/**
 * An isolated interactive browser window with its own cookie jar.
 */
public interface BrowsingContext {

  String partition();

  /**
   * Every cookie currently in this context's jar. Only safe to call from a
   * {@link BrowsingContextListener} callback.
   */
  List<BrowserCookie> cookies();

  /**
   * Requests the window to close. Returns immediately; the listener's
   * {@link BrowsingContextListener#onClosed(BrowsingContext)} follows once it has.
   */
  void close();

  boolean isClosed();
}
