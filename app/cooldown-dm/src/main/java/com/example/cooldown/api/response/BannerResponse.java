package com.example.cooldown.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BannerResponse(boolean loggedIn, Boolean dmReady, boolean showBanner) {

  public static BannerResponse anonymous() {
    return new BannerResponse(false, null, false);
  }

  public static BannerResponse of(boolean dmReady) {
    return new BannerResponse(true, dmReady, !dmReady);
  }
}
