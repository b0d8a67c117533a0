package io.b2mash.b2b.datasync.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.security.web.util.matcher.IpAddressMatcher;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Works out the caller's IP address once per request and stores it for audit events and security
 * logs. Forwarding headers are only believed when the socket peer is a trusted proxy; otherwise a
 * client could put any address into the audit trail.
 *
 * <p>{@code X-Forwarded-For} is read from the right: trusted proxies are skipped and the first
 * address that is not one of them is the client.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ClientIpResolver extends OncePerRequestFilter {

  static final String CLIENT_IP_ATTRIBUTE = ClientIpResolver.class.getName() + ".clientIp";

  private final List<IpAddressMatcher> trustedProxies;

  /**
   * @param trustedProxies comma-separated addresses or CIDR ranges of the reverse proxies in front
   *     of the service
   */
  public ClientIpResolver(
      @Value("${datasync.security.trusted-proxies:127.0.0.1/32,::1/128}") String trustedProxies) {
    this.trustedProxies =
        Arrays.stream(trustedProxies.split(","))
            .map(String::trim)
            .filter(entry -> !entry.isEmpty())
            .map(IpAddressMatcher::new)
            .toList();
  }

  /**
   * The address resolved for this request, or the socket address when the request did not pass
   * through this filter.
   */
  public static String clientIp(HttpServletRequest request) {
    Object resolved = request.getAttribute(CLIENT_IP_ATTRIBUTE);
    return resolved instanceof String ip ? ip : request.getRemoteAddr();
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    request.setAttribute(CLIENT_IP_ATTRIBUTE, resolve(request));
    filterChain.doFilter(request, response);
  }

  String resolve(HttpServletRequest request) {
    String peer = request.getRemoteAddr();
    if (!isTrustedProxy(peer)) {
      return peer;
    }
    String forwardedFor = request.getHeader("X-Forwarded-For");
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      String[] hops = forwardedFor.split(",");
      for (int i = hops.length - 1; i >= 0; i--) {
        String hop = hops[i].trim();
        if (!hop.isEmpty() && !isTrustedProxy(hop)) {
          return hop;
        }
      }
      // Every hop is one of ours.
      String first = hops.length > 0 ? hops[0].trim() : "";
      return first.isEmpty() ? peer : first;
    }
    String realIp = request.getHeader("X-Real-IP");
    if (realIp != null && !realIp.isBlank()) {
      return realIp.trim();
    }
    return peer;
  }

  private boolean isTrustedProxy(String address) {
    if (address == null) {
      return false;
    }
    try {
      return trustedProxies.stream().anyMatch(matcher -> matcher.matches(address));
    } catch (IllegalArgumentException e) {
      // Not an IP address, so not a proxy we know.
      return false;
    }
  }
}
