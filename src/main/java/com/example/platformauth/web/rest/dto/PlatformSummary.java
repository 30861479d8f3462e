package com.example.platformauth.web.rest.dto;

import com.example.platformauth.domain.entity.PlatformDescriptor;

public record PlatformSummary(String id, String name, String loginUrl) {

  public static PlatformSummary from(PlatformDescriptor platform) {
    return new PlatformSummary(platform.id(), platform.name(), platform.loginUrl());
  }
}
