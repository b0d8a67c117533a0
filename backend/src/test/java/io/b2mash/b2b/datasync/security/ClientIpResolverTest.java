package io.b2mash.b2b.datasync.security;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class ClientIpResolverTest {

  private final ClientIpResolver resolver = new ClientIpResolver("10.0.0.0/8, 127.0.0.1/32");

  @Test
  void untrustedPeer_forwardingHeadersAreIgnored() {
    var request = request("203.0.113.7");
    request.addHeader("X-Forwarded-For", "198.51.100.1");
    request.addHeader("X-Real-IP", "198.51.100.2");

    assertThat(resolver.resolve(request)).isEqualTo("203.0.113.7");
  }

  @Test
  void trustedPeer_takesFirstUntrustedHopFromTheRight() {
    var request = request("10.0.0.5");
    // The left-most entry is whatever the client sent; only the hop our proxy appended counts.
    request.addHeader("X-Forwarded-For", "6.6.6.6, 198.51.100.9, 10.0.0.4");

    assertThat(resolver.resolve(request)).isEqualTo("198.51.100.9");
  }

  @Test
  void trustedPeer_allHopsTrusted_returnsLeftMost() {
    var request = request("10.0.0.5");
    request.addHeader("X-Forwarded-For", "10.1.2.3, 10.0.0.4");

    assertThat(resolver.resolve(request)).isEqualTo("10.1.2.3");
  }

  @Test
  void trustedPeer_fallsBackToRealIpHeader() {
    var request = request("127.0.0.1");
    request.addHeader("X-Real-IP", " 198.51.100.20 ");

    assertThat(resolver.resolve(request)).isEqualTo("198.51.100.20");
  }

  @Test
  void trustedPeer_nonAddressHop_isTreatedAsClient() {
    var request = request("10.0.0.5");
    request.addHeader("X-Forwarded-For", "unknown");

    assertThat(resolver.resolve(request)).isEqualTo("unknown");
  }

  @Test
  void trustedPeerWithoutHeaders_isTheClient() {
    assertThat(resolver.resolve(request("10.0.0.5"))).isEqualTo("10.0.0.5");
  }

  @Test
  void filter_storesResolvedAddressForTheRestOfTheRequest()
      throws ServletException, IOException {
    var request = request("10.0.0.5");
    request.addHeader("X-Forwarded-For", "198.51.100.9");
    var seen = new String[1];

    resolver.doFilter(
        request,
        new MockHttpServletResponse(),
        (req, res) -> seen[0] = ClientIpResolver.clientIp((HttpServletRequest) req));

    assertThat(seen[0]).isEqualTo("198.51.100.9");
  }

  @Test
  void clientIp_withoutFilter_usesSocketAddress() {
    var request = request("203.0.113.7");
    request.addHeader("X-Forwarded-For", "198.51.100.1");

    assertThat(ClientIpResolver.clientIp(request)).isEqualTo("203.0.113.7");
  }

  private static MockHttpServletRequest request(String remoteAddr) {
    var request = new MockHttpServletRequest("GET", "/api/integrations");
    request.setRemoteAddr(remoteAddr);
    return request;
  }
}
