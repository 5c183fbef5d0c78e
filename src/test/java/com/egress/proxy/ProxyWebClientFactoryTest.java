package com.egress.proxy;

import com.egress.bean.ProxyIdentity;
import com.egress.bean.ProxyPoolProperties;
import org.junit.jupiter.api.Test;
import reactor.netty.transport.ProxyProvider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProxyWebClientFactoryTest {

    @Test
    void mapsProtocolsToProxyTypes() {
        assertThat(ProxyWebClientFactory.proxyType("http")).isEqualTo(ProxyProvider.Proxy.HTTP);
        assertThat(ProxyWebClientFactory.proxyType("HTTPS")).isEqualTo(ProxyProvider.Proxy.HTTP);
        assertThat(ProxyWebClientFactory.proxyType("socks4")).isEqualTo(ProxyProvider.Proxy.SOCKS4);
        assertThat(ProxyWebClientFactory.proxyType("socks5")).isEqualTo(ProxyProvider.Proxy.SOCKS5);
        assertThatThrownBy(() -> ProxyWebClientFactory.proxyType("ftp")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void buildsClientForAuthenticatedSocksCandidate() {
        ProxyPoolProperties props = new ProxyPoolProperties();
        props.setProtocol("socks5");
        ProxyWebClientFactory factory = new ProxyWebClientFactory(props);

        assertThat(factory.build(Candidate.from(new ProxyIdentity("1.1.1.1", 1080, "user", "pass")))).isNotNull();
    }

    @Test
    void followsRedirectsUpToConfiguredCap() {
        assertThat(ProxyWebClientFactory.followsRedirect(302, 9, 10)).isTrue();
        assertThat(ProxyWebClientFactory.followsRedirect(302, 10, 10)).isFalse();
        assertThat(ProxyWebClientFactory.followsRedirect(301, 0, 10)).isTrue();
        assertThat(ProxyWebClientFactory.followsRedirect(307, 0, 10)).isTrue();
        assertThat(ProxyWebClientFactory.followsRedirect(308, 0, 10)).isTrue();
    }

    @Test
    void nonRedirectStatusesAreNotFollowed() {
        assertThat(ProxyWebClientFactory.followsRedirect(200, 0, 10)).isFalse();
        assertThat(ProxyWebClientFactory.followsRedirect(304, 0, 10)).isFalse();
        assertThat(ProxyWebClientFactory.followsRedirect(404, 0, 10)).isFalse();
    }
}
