package com.warden.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Extracts the receiver-side ticket from a WS-Security token envelope.
 * <p>
 * The envelope is the UTF-8 XML form of a {@code wsse:BinarySecurityToken}, either as the
 * document element or nested inside a {@code wsse:Security} header:
 * <pre>
 * &lt;wsse:BinarySecurityToken ValueType="...#GSS_Kerberosv5_AP_REQ" wsu:Id="t1"&gt;base64&lt;/...&gt;
 * </pre>
 * DTDs and external entities are refused.
 */
public final class WsSecurityTicketDecoder {

    public static final String WSSE_NAMESPACE =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-wssecurity-secext-1.0.xsd";
    public static final String WSU_NAMESPACE =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-wssecurity-utility-1.0.xsd";

    private static final Logger log = LoggerFactory.getLogger(WsSecurityTicketDecoder.class);

    private static final String TOKEN_ELEMENT = "BinarySecurityToken";

    private final XMLInputFactory factory;

    public WsSecurityTicketDecoder() {
        factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
    }

    /**
     * Decodes the envelope.
     *
     * @param tokenData the raw token bytes
     * @return the document element name and the extracted ticket
     * @throws TicketDecodingException if the bytes are not a well-formed envelope holding a ticket
     */
    public DecodedTicket decode(byte[] tokenData) {
        String xml = new String(tokenData, StandardCharsets.UTF_8).strip();
        String rootElement = null;
        XMLStreamReader reader = null;
        try {
            reader = factory.createXMLStreamReader(new StringReader(xml));
            while (reader.hasNext()) {
                if (reader.next() != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                if (rootElement == null) {
                    rootElement = reader.getLocalName();
                }
                if (TOKEN_ELEMENT.equals(reader.getLocalName()) && WSSE_NAMESPACE.equals(reader.getNamespaceURI())) {
                    return new DecodedTicket(rootElement, readTicket(reader));
                }
            }
            throw new TicketDecodingException(rootElement, "no " + TOKEN_ELEMENT + " element", null);
        } catch (XMLStreamException | IllegalArgumentException e) {
            throw new TicketDecodingException(rootElement, e.getMessage(), e);
        } finally {
            if (reader != null) {
                try {
                    reader.close();
                } catch (XMLStreamException e) {
                    log.debug("Failed to close token reader", e);
                }
            }
        }
    }

    private static ReceiverTicket readTicket(XMLStreamReader reader) throws XMLStreamException {
        String valueType = reader.getAttributeValue(null, "ValueType");
        String id = reader.getAttributeValue(WSU_NAMESPACE, "Id");
        String encoded = reader.getElementText();
        byte[] ticket = Base64.getMimeDecoder().decode(encoded.strip());
        if (ticket.length == 0) {
            throw new IllegalArgumentException("empty ticket");
        }
        return new ReceiverTicket(valueType, id, ticket);
    }

    /**
     * @param rootElement local name of the document element
     * @param ticket      the extracted ticket
     */
    public record DecodedTicket(String rootElement, ReceiverTicket ticket) {
    }

    /**
     * Thrown when a token envelope cannot be decoded.
     */
    public static class TicketDecodingException extends RuntimeException {

        private final String rootElement;

        public TicketDecodingException(String rootElement, String message, Throwable cause) {
            super(message, cause);
            this.rootElement = rootElement;
        }

        /** Local name of the document element, or null if the document never started. */
        public String rootElement() {
            return rootElement;
        }
    }
}
