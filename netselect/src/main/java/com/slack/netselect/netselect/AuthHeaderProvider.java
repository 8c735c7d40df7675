package com.slack.netselect.netselect;

import com.linecorp.armeria.common.HttpHeaders;

/** Supplies the auth headers attached to every request sent to a storage node. */
@FunctionalInterface
public interface AuthHeaderProvider {
  AuthHeaderProvider NONE = addr -> HttpHeaders.of();

  HttpHeaders getHeaders(String addr);
}
