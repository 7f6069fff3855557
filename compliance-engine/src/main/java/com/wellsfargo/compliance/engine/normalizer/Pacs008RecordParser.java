package com.wellsfargo.compliance.engine.normalizer;

import com.wellsfargo.compliance.canonical.CanonicalPaymentRecord;
import com.wellsfargo.compliance.canonical.enums.RecordFormat;
import com.wellsfargo.compliance.error.MalformedRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parser for ISO 20022 PACS.008 (FI to FI Customer Credit Transfer) XML messages.
 *
 * Extracts every field the compliance checks may need from the group header
 * and the first CdtTrfTxInf:
 * - Group header: MsgId, CreDtTm, NbOfTxs, IntrBkSttlmDt, SttlmMtd, ClrSys,
 *   TtlIntrBkSttlmAmt
 * - Payment type: SvcLvl, LclInstrm, CtgyPurp (transaction level wins over header)
 * - Transaction: InstrId, EndToEndId, TxId, IntrBkSttlmAmt or InstdAmt, ChrgBr, Purp
 * - Parties: Dbtr, DbtrAcct, DbtrAgt, Cdtr, CdtrAcct, CdtrAgt
 * - Remittance: RmtInf/Ustrd, RmtInf/Strd/CdtrRefInf
 *
 * Lookups are namespace-agnostic and null-safe: a missing path yields null,
 * never an exception. Only a document that is not XML, or that has no
 * FIToFICstmrCdtTrf element, is rejected.
 */
public class Pacs008RecordParser {

    private static final Logger log = LoggerFactory.getLogger(Pacs008RecordParser.class);

    private static final String FITOFI_CSTM_CDT_TRF = "FIToFICstmrCdtTrf";
    private static final String GRP_HDR = "GrpHdr";
    private static final String CDT_TRF_TX_INF = "CdtTrfTxInf";
    private static final String PMT_TP_INF = "PmtTpInf";
    private static final String DEFAULT_SCHEME = "SEPA";

    private static final DocumentBuilderFactory DOCUMENT_BUILDER_FACTORY;

    // Report parse problems through the exception only, not on stderr
    private static final ErrorHandler PARSE_ERROR_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            log.debug("XML parser warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    static {
        DOCUMENT_BUILDER_FACTORY = DocumentBuilderFactory.newInstance();
        DOCUMENT_BUILDER_FACTORY.setNamespaceAware(true);
        // Disable DOCTYPE and external entity resolution (XXE)
        try {
            DOCUMENT_BUILDER_FACTORY.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DOCUMENT_BUILDER_FACTORY.setFeature("http://xml.org/sax/features/external-general-entities", false);
            DOCUMENT_BUILDER_FACTORY.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            DOCUMENT_BUILDER_FACTORY.setExpandEntityReferences(false);
        } catch (ParserConfigurationException e) {
            log.warn("Failed to configure XML parser security features", e);
        }
    }

    /**
     * Parse a PACS.008 XML string into a canonical record.
     *
     * @param xmlMessage the XML message
     * @param scheme scheme to assign, null for the SEPA default
     * @return canonical record with every present field populated
     * @throws MalformedRecordException if the message is empty, not XML, or not a PACS.008
     */
    public CanonicalPaymentRecord parse(String xmlMessage, String scheme) throws MalformedRecordException {
        if (xmlMessage == null || xmlMessage.trim().isEmpty()) {
            throw new MalformedRecordException("XML message cannot be null or empty");
        }

        try (InputStream inputStream = new ByteArrayInputStream(xmlMessage.trim().getBytes(StandardCharsets.UTF_8))) {
            DocumentBuilder documentBuilder = DOCUMENT_BUILDER_FACTORY.newDocumentBuilder();
            documentBuilder.setErrorHandler(PARSE_ERROR_HANDLER);
            Document document = documentBuilder.parse(inputStream);
            return toRecord(document, scheme);
        } catch (ParserConfigurationException e) {
            throw new MalformedRecordException("Failed to configure XML parser", e);
        } catch (SAXException e) {
            throw new MalformedRecordException("Failed to parse PACS.008 XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedRecordException("Failed to read XML message", e);
        }
    }

    private CanonicalPaymentRecord toRecord(Document document, String scheme) throws MalformedRecordException {
        Element rootElement = document.getDocumentElement();
        if (rootElement == null) {
            throw new MalformedRecordException("XML document has no root element");
        }

        // FIToFICstmrCdtTrf may be the root or sit anywhere below Document
        Element fitofi = matches(rootElement, FITOFI_CSTM_CDT_TRF)
            ? rootElement
            : findDescendant(rootElement, FITOFI_CSTM_CDT_TRF);
        if (fitofi == null) {
            throw new MalformedRecordException("PACS.008 message must contain FIToFICstmrCdtTrf element");
        }

        Element grpHdr = findChild(fitofi, GRP_HDR);
        Element tx = findChild(fitofi, CDT_TRF_TX_INF);
        if (tx == null) {
            log.debug("PACS.008 message has no CdtTrfTxInf, only group header fields are available");
        }

        Element txPmtTpInf = findChild(tx, PMT_TP_INF);
        Element hdrPmtTpInf = findChild(grpHdr, PMT_TP_INF);

        AmountInfo amountInfo = extractAmount(tx);
        if (amountInfo == null) {
            amountInfo = toAmountInfo(findChild(grpHdr, "TtlIntrBkSttlmAmt"));
        }

        Map<String, Object> extensions = new LinkedHashMap<>();
        putIfPresent(extensions, "number_of_transactions", text(grpHdr, "NbOfTxs"));
        putIfPresent(extensions, "acceptance_date_time", text(tx, "AccptncDtTm"));
        putIfPresent(extensions, "instructing_agent", bic(findChild(grpHdr, "InstgAgt")));
        putIfPresent(extensions, "instructed_agent", bic(findChild(grpHdr, "InstdAgt")));
        putIfPresent(extensions, "ultimate_debtor_name", text(tx, "UltmtDbtr/Nm"));
        putIfPresent(extensions, "ultimate_creditor_name", text(tx, "UltmtCdtr/Nm"));
        putIfPresent(extensions, "debtor_proxy", text(tx, "DbtrAcct/Prxy/Id"));
        putIfPresent(extensions, "creditor_proxy", text(tx, "CdtrAcct/Prxy/Id"));

        String clearingSystem = firstPresent(
            text(grpHdr, "SttlmInf/ClrSys/Prtry"),
            text(grpHdr, "SttlmInf/ClrSys/Cd"));

        return CanonicalPaymentRecord.builder()
            .transactionId(text(tx, "PmtId/TxId"))
            .endToEndId(text(tx, "PmtId/EndToEndId"))
            .messageId(text(grpHdr, "MsgId"))
            .instructionId(text(tx, "PmtId/InstrId"))
            .scheme(scheme != null ? scheme : DEFAULT_SCHEME)
            .amount(amountInfo != null ? amountInfo.amount : null)
            .rawAmount(amountInfo != null ? amountInfo.rawAmount : null)
            .currency(amountInfo != null ? amountInfo.currency : null)
            .creationDateTime(text(grpHdr, "CreDtTm"))
            .settlementDate(firstPresent(text(grpHdr, "IntrBkSttlmDt"), text(tx, "IntrBkSttlmDt")))
            .settlementMethod(text(grpHdr, "SttlmInf/SttlmMtd"))
            .clearingSystem(clearingSystem)
            .serviceLevel(firstPresent(text(txPmtTpInf, "SvcLvl/Cd"), text(hdrPmtTpInf, "SvcLvl/Cd")))
            .localInstrument(firstPresent(text(txPmtTpInf, "LclInstrm/Cd"), text(hdrPmtTpInf, "LclInstrm/Cd")))
            .categoryPurpose(firstPresent(text(txPmtTpInf, "CtgyPurp/Cd"), text(hdrPmtTpInf, "CtgyPurp/Cd")))
            .purposeCode(text(tx, "Purp/Cd"))
            .chargeBearer(text(tx, "ChrgBr"))
            .debtorName(text(tx, "Dbtr/Nm"))
            .debtorCountry(text(tx, "Dbtr/PstlAdr/Ctry"))
            .debtorIban(text(tx, "DbtrAcct/Id/IBAN"))
            .debtorAgentBic(bic(findChild(tx, "DbtrAgt")))
            .creditorName(text(tx, "Cdtr/Nm"))
            .creditorCountry(text(tx, "Cdtr/PstlAdr/Ctry"))
            .creditorIban(text(tx, "CdtrAcct/Id/IBAN"))
            .creditorAgentBic(bic(findChild(tx, "CdtrAgt")))
            .remittanceInformation(text(tx, "RmtInf/Ustrd"))
            .creditorReference(text(tx, "RmtInf/Strd/CdtrRefInf/Ref"))
            .creditorReferenceType(text(tx, "RmtInf/Strd/CdtrRefInf/Tp/CdOrPrtry/Cd"))
            .sourceFormat(RecordFormat.ISO20022_PACS008)
            .extensions(extensions)
            .build();
    }

    /**
     * Extract amount and currency. Checks IntrBkSttlmAmt first, then Amt/InstdAmt.
     */
    private AmountInfo extractAmount(Element tx) {
        AmountInfo settlement = toAmountInfo(findChild(tx, "IntrBkSttlmAmt"));
        if (settlement != null) {
            return settlement;
        }
        return toAmountInfo(findPath(tx, "Amt/InstdAmt"));
    }

    private AmountInfo toAmountInfo(Element amountElement) {
        String rawAmount = textOf(amountElement);
        if (rawAmount == null || rawAmount.isEmpty()) {
            return null;
        }
        String currency = amountElement.getAttribute("Ccy");
        BigDecimal amount = null;
        try {
            amount = new BigDecimal(rawAmount);
        } catch (NumberFormatException e) {
            log.warn("Failed to parse amount '{}', keeping raw value only", rawAmount);
        }
        return new AmountInfo(amount, rawAmount, currency == null || currency.isEmpty() ? null : currency.trim());
    }

    /**
     * Extract agent BIC from FinInstnId. Supports both BICFI and the older BIC element.
     */
    private String bic(Element agentElement) {
        return firstPresent(text(agentElement, "FinInstnId/BICFI"), text(agentElement, "FinInstnId/BIC"));
    }

    /**
     * Resolve a slash-separated path of direct children and return its trimmed text.
     */
    private static String text(Element parent, String path) {
        return textOf(findPath(parent, path));
    }

    private static Element findPath(Element parent, String path) {
        Element current = parent;
        for (String segment : path.split("/")) {
            if (current == null) {
                return null;
            }
            current = findChild(current, segment);
        }
        return current;
    }

    /**
     * Find a direct child element by local name (namespace-agnostic).
     */
    private static Element findChild(Element parent, String localName) {
        if (parent == null) {
            return null;
        }

        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && matches((Element) node, localName)) {
                return (Element) node;
            }
        }
        return null;
    }

    /**
     * Depth-first search for the first descendant with the given local name.
     */
    private static Element findDescendant(Element parent, String localName) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            Element element = (Element) node;
            if (matches(element, localName)) {
                return element;
            }
            Element nested = findDescendant(element, localName);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    private static boolean matches(Element element, String localName) {
        String elementLocalName = element.getLocalName();
        String elementTagName = element.getTagName();
        return localName.equals(elementLocalName)
            || localName.equals(elementTagName)
            || elementTagName.endsWith(":" + localName);
    }

    private static String textOf(Element element) {
        if (element == null) {
            return null;
        }
        String text = element.getTextContent();
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String firstPresent(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static void putIfPresent(Map<String, Object> target, String key, String value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    private static class AmountInfo {
        final BigDecimal amount;
        final String rawAmount;
        final String currency;

        AmountInfo(BigDecimal amount, String rawAmount, String currency) {
            this.amount = amount;
            this.rawAmount = rawAmount;
            this.currency = currency;
        }
    }
}
