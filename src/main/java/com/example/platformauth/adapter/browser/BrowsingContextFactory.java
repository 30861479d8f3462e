package com.example.platformauth.adapter.browser;

import com.example.platformauth.exception.BrowserLaunchException;

public interface BrowsingContextFactory {

  /**
   * Opens a window on {@code startUrl} using the storage of {@code partition}. Returns once the
   * window exists; navigation proceeds asynchronously.
   *
   * @throws BrowserLaunchException when no browser could be started
   */
  BrowsingContext open(String partition, String startUrl, BrowsingContextListener listener);

  /**
   * Discards all stored cookies and site data of a partition. The partition must not be open.
   */
  void clearPartition(String partition);
}
