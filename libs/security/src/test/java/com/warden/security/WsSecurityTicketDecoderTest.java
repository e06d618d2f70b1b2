package com.warden.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WsSecurityTicketDecoder")
class WsSecurityTicketDecoderTest {

    private static final String KERBEROS_AP_REQ =
            "http://docs.oasis-open.org/wss/oasis-wss-kerberos-token-profile-1.1#GSS_Kerberosv5_AP_REQ";

    private final WsSecurityTicketDecoder decoder = new WsSecurityTicketDecoder();

    private static byte[] utf8(String xml) {
        return xml.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("extracts the ticket from a bare token element")
    void bareToken() {
        var decoded = decoder.decode(utf8("""
                <wsse:BinarySecurityToken xmlns:wsse="%s" xmlns:wsu="%s" ValueType="%s" wsu:Id="t1">AQID
                BA==</wsse:BinarySecurityToken>
                """.formatted(WsSecurityTicketDecoder.WSSE_NAMESPACE, WsSecurityTicketDecoder.WSU_NAMESPACE, KERBEROS_AP_REQ)));

        assertThat(decoded.rootElement()).isEqualTo("BinarySecurityToken");
        assertThat(decoded.ticket().valueType()).isEqualTo(KERBEROS_AP_REQ);
        assertThat(decoded.ticket().id()).isEqualTo("t1");
        assertThat(decoded.ticket().ticket()).containsExactly(1, 2, 3, 4);
    }

    @Test
    @DisplayName("finds the token nested in a security header and reports the document element")
    void nestedToken() {
        var decoded = decoder.decode(utf8("""

                <wsse:Security xmlns:wsse="%s">
                  <wsse:BinarySecurityToken ValueType="%s">AQ==</wsse:BinarySecurityToken>
                </wsse:Security>
                """.formatted(WsSecurityTicketDecoder.WSSE_NAMESPACE, KERBEROS_AP_REQ)));

        assertThat(decoded.rootElement()).isEqualTo("Security");
        assertThat(decoded.ticket().id()).isNull();
        assertThat(decoded.ticket().ticket()).containsExactly(1);
    }

    @Test
    @DisplayName("token element in another namespace is not a ticket")
    void wrongNamespace() {
        assertThatThrownBy(() -> decoder.decode(utf8(
                "<Envelope><BinarySecurityToken>AQ==</BinarySecurityToken></Envelope>")))
                .isInstanceOf(WsSecurityTicketDecoder.TicketDecodingException.class)
                .satisfies(e -> assertThat(((WsSecurityTicketDecoder.TicketDecodingException) e).rootElement())
                        .isEqualTo("Envelope"));
    }

    @Test
    @DisplayName("truncated XML keeps the root element name")
    void truncated() {
        assertThatThrownBy(() -> decoder.decode(utf8("<Envelope><broken")))
                .isInstanceOf(WsSecurityTicketDecoder.TicketDecodingException.class)
                .satisfies(e -> assertThat(((WsSecurityTicketDecoder.TicketDecodingException) e).rootElement())
                        .isEqualTo("Envelope"));
    }

    @Test
    @DisplayName("non-XML input has no root element")
    void notXml() {
        assertThatThrownBy(() -> decoder.decode(utf8("not xml at all")))
                .isInstanceOf(WsSecurityTicketDecoder.TicketDecodingException.class)
                .satisfies(e -> assertThat(((WsSecurityTicketDecoder.TicketDecodingException) e).rootElement())
                        .isNull());
    }

    @Test
    @DisplayName("empty ticket text is rejected")
    void emptyTicket() {
        assertThatThrownBy(() -> decoder.decode(utf8(
                "<wsse:BinarySecurityToken xmlns:wsse=\"" + WsSecurityTicketDecoder.WSSE_NAMESPACE
                        + "\" ValueType=\"x\"></wsse:BinarySecurityToken>")))
                .isInstanceOf(WsSecurityTicketDecoder.TicketDecodingException.class)
                .hasMessageContaining("empty ticket");
    }
}
