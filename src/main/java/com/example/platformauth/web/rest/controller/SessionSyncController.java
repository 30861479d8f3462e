package com.example.platformauth.web.rest.controller;

import com.example.platformauth.domain.entity.CaptureChannel;
import com.example.platformauth.domain.entity.SaveResult;
import com.example.platformauth.service.PlatformRegistry;
import com.example.platformauth.service.SessionStore;
import com.example.platformauth.web.rest.dto.SyncRequest;
import com.example.platformauth.web.rest.dto.SyncResponse;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class SessionSyncController implements SessionSyncAPI {

  private final PlatformRegistry platformRegistry;
  private final SessionStore sessionStore;

  @Override
  public ResponseEntity<SyncResponse> syncCookies(SyncRequest request) {
    String platformId = platformRegistry.require(request.platform()).id();

    SaveResult result = request.timestamp() == null
        ? sessionStore.save(platformId, request.cookies(), CaptureChannel.EXTENSION_SYNC)
        : sessionStore.save(platformId, request.cookies(), CaptureChannel.EXTENSION_SYNC,
                            Instant.ofEpochMilli(request.timestamp()));
    return ResponseEntity.ok(SyncResponse.from(platformId, result));
  }
}
