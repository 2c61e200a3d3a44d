/*
 * どこで: Crons サービス層
 * 何を: リースや outbox claim の所有者名としてノード名を解決する
 * なぜ: どのノードが行を握っているかを運用で追えるようにするため
 */
package com.example.crons.service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class NodeIdentity {

  private static final Logger logger = LoggerFactory.getLogger(NodeIdentity.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private NodeIdentity() {}

  static String resolve() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
