package com.example.platformauth.web.rest.dto;

/**
 * Cookie header of a fresh session, ready to be sent as a {@code Cookie} request header.
 */
public record SessionCookiesResponse(String platform, String cookies) {}
