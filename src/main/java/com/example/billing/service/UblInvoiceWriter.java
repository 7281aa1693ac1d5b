package com.example.billing.service;

import com.example.billing.exception.DocumentRenderingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Writes an {@link InvoiceExport} as a simplified UBL 2.1 Invoice document.
 *
 * Amounts carry a currencyID attribute and are written with two decimals.
 * Taxes appear once per invoice, grouped by rate, and once per line.
 */
@Component
public class UblInvoiceWriter {

    private static final Logger log = LoggerFactory.getLogger(UblInvoiceWriter.class);

    static final String NS_INVOICE = "urn:oasis:names:specification:ubl:schema:xsd:Invoice-2";
    static final String NS_CAC = "urn:oasis:names:specification:ubl:schema:xsd:CommonAggregateComponents-2";
    static final String NS_CBC = "urn:oasis:names:specification:ubl:schema:xsd:CommonBasicComponents-2";

    private static final String UNIT_CODE_PIECE = "C62";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final String currencyCode;
    private final String supplierName;
    private final String supplierTaxNumber;
    private final String supplierEmail;
    private final String taxSchemeName;

    public UblInvoiceWriter(@Value("${billing.export.currency:TRY}") String currencyCode,
                            @Value("${billing.export.supplier.name:}") String supplierName,
                            @Value("${billing.export.supplier.tax-number:0000000000}") String supplierTaxNumber,
                            @Value("${billing.export.supplier.email:}") String supplierEmail,
                            @Value("${billing.export.tax-scheme:KDV}") String taxSchemeName) {
        this.currencyCode = currencyCode;
        this.supplierName = supplierName;
        this.supplierTaxNumber = supplierTaxNumber;
        this.supplierEmail = supplierEmail;
        this.taxSchemeName = taxSchemeName;
    }

    public String write(InvoiceExport invoice) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter xml = XMLOutputFactory.newInstance().createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.setDefaultNamespace(NS_INVOICE);
            xml.setPrefix("cac", NS_CAC);
            xml.setPrefix("cbc", NS_CBC);
            xml.writeStartElement(NS_INVOICE, "Invoice");
            xml.writeDefaultNamespace(NS_INVOICE);
            xml.writeNamespace("cac", NS_CAC);
            xml.writeNamespace("cbc", NS_CBC);

            text(xml, "UBLVersionID", "2.1");
            text(xml, "ID", invoice.invoiceNumber());
            text(xml, "IssueDate", invoice.invoiceDate().toString());
            text(xml, "IssueTime", invoice.createdAt() != null
                ? TIME_FORMAT.format(invoice.createdAt().atZone(ZoneId.systemDefault())) : "00:00:00");
            if (invoice.dueDate() != null) {
                text(xml, "DueDate", invoice.dueDate().toString());
            }
            text(xml, "InvoiceTypeCode", "380");
            if (invoice.notes() != null && !invoice.notes().isBlank()) {
                text(xml, "Note", invoice.notes());
            }
            text(xml, "DocumentCurrencyCode", currencyCode);

            writeSupplier(xml);
            writeCustomer(xml, invoice.customer());

            if (invoice.dueDate() != null) {
                xml.writeStartElement(NS_CAC, "PaymentMeans");
                text(xml, "PaymentMeansCode", "1");
                text(xml, "PaymentDueDate", invoice.dueDate().toString());
                xml.writeEndElement();
            }

            xml.writeStartElement(NS_CAC, "TaxTotal");
            amount(xml, "TaxAmount", invoice.taxTotal());
            for (InvoiceExport.TaxGroup group : invoice.taxGroups()) {
                writeTaxSubtotal(xml, group.taxableAmount(), group.taxAmount(), group.rate());
            }
            xml.writeEndElement();

            xml.writeStartElement(NS_CAC, "LegalMonetaryTotal");
            amount(xml, "LineExtensionAmount", invoice.subtotal());
            amount(xml, "TaxExclusiveAmount", invoice.subtotal());
            amount(xml, "TaxInclusiveAmount", invoice.total());
            amount(xml, "PrepaidAmount", invoice.amountPaid());
            amount(xml, "PayableAmount", invoice.remainingAmount());
            xml.writeEndElement();

            for (InvoiceExport.Line line : invoice.lines()) {
                writeLine(xml, line);
            }

            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            log.error("Failed to write UBL document for invoice {}", invoice.invoiceNumber(), e);
            throw new DocumentRenderingException("Failed to write UBL document for invoice "
                + invoice.invoiceNumber() + ": " + e.getMessage(), e);
        }
        return out.toString();
    }

    private void writeSupplier(XMLStreamWriter xml) throws XMLStreamException {
        xml.writeStartElement(NS_CAC, "AccountingSupplierParty");
        xml.writeStartElement(NS_CAC, "Party");
        partyIdentification(xml, supplierTaxNumber);
        partyName(xml, supplierName);
        if (!supplierEmail.isBlank()) {
            xml.writeStartElement(NS_CAC, "Contact");
            text(xml, "ElectronicMail", supplierEmail);
            xml.writeEndElement();
        }
        xml.writeEndElement();
        xml.writeEndElement();
    }

    private void writeCustomer(XMLStreamWriter xml, InvoiceExport.Party customer) throws XMLStreamException {
        xml.writeStartElement(NS_CAC, "AccountingCustomerParty");
        xml.writeStartElement(NS_CAC, "Party");
        if (customer.taxNumber() != null && !customer.taxNumber().isBlank()) {
            partyIdentification(xml, customer.taxNumber());
        }
        partyName(xml, customer.name());
        if (customer.address() != null && !customer.address().isBlank()) {
            xml.writeStartElement(NS_CAC, "PostalAddress");
            text(xml, "StreetName", customer.address());
            if (customer.city() != null && !customer.city().isBlank()) {
                text(xml, "CityName", customer.city());
            }
            xml.writeEndElement();
        }
        if (customer.taxOffice() != null && !customer.taxOffice().isBlank()) {
            xml.writeStartElement(NS_CAC, "PartyTaxScheme");
            xml.writeStartElement(NS_CAC, "TaxScheme");
            text(xml, "Name", customer.taxOffice());
            xml.writeEndElement();
            xml.writeEndElement();
        }
        if (customer.email() != null && !customer.email().isBlank()) {
            xml.writeStartElement(NS_CAC, "Contact");
            text(xml, "ElectronicMail", customer.email());
            xml.writeEndElement();
        }
        xml.writeEndElement();
        xml.writeEndElement();
    }

    private void writeLine(XMLStreamWriter xml, InvoiceExport.Line line) throws XMLStreamException {
        xml.writeStartElement(NS_CAC, "InvoiceLine");
        text(xml, "ID", String.valueOf(line.lineNumber()));
        xml.writeStartElement(NS_CBC, "InvoicedQuantity");
        xml.writeAttribute("unitCode", UNIT_CODE_PIECE);
        xml.writeCharacters(format(line.quantity()));
        xml.writeEndElement();
        amount(xml, "LineExtensionAmount", line.lineTotal());

        xml.writeStartElement(NS_CAC, "TaxTotal");
        amount(xml, "TaxAmount", line.taxAmount());
        writeTaxSubtotal(xml, line.lineTotal(), line.taxAmount(), line.taxRate());
        xml.writeEndElement();

        xml.writeStartElement(NS_CAC, "Item");
        text(xml, "Name", line.description());
        xml.writeEndElement();

        xml.writeStartElement(NS_CAC, "Price");
        amount(xml, "PriceAmount", line.unitPrice());
        xml.writeEndElement();
        xml.writeEndElement();
    }

    private void writeTaxSubtotal(XMLStreamWriter xml, BigDecimal taxable, BigDecimal tax, int rate)
            throws XMLStreamException {
        xml.writeStartElement(NS_CAC, "TaxSubtotal");
        amount(xml, "TaxableAmount", taxable);
        amount(xml, "TaxAmount", tax);
        text(xml, "Percent", String.valueOf(rate));
        xml.writeStartElement(NS_CAC, "TaxCategory");
        xml.writeStartElement(NS_CAC, "TaxScheme");
        text(xml, "Name", taxSchemeName);
        xml.writeEndElement();
        xml.writeEndElement();
        xml.writeEndElement();
    }

    private void partyIdentification(XMLStreamWriter xml, String taxNumber) throws XMLStreamException {
        String cleaned = taxNumber.trim();
        xml.writeStartElement(NS_CAC, "PartyIdentification");
        xml.writeStartElement(NS_CBC, "ID");
        // 11 digits identify a person, 10 a company
        xml.writeAttribute("schemeID", cleaned.length() == 11 ? "TCKN" : "VKN");
        xml.writeCharacters(cleaned);
        xml.writeEndElement();
        xml.writeEndElement();
    }

    private void partyName(XMLStreamWriter xml, String name) throws XMLStreamException {
        xml.writeStartElement(NS_CAC, "PartyName");
        text(xml, "Name", name != null ? name : "");
        xml.writeEndElement();
    }

    private void text(XMLStreamWriter xml, String localName, String value) throws XMLStreamException {
        xml.writeStartElement(NS_CBC, localName);
        xml.writeCharacters(value);
        xml.writeEndElement();
    }

    private void amount(XMLStreamWriter xml, String localName, BigDecimal value) throws XMLStreamException {
        xml.writeStartElement(NS_CBC, localName);
        xml.writeAttribute("currencyID", currencyCode);
        xml.writeCharacters(format(value));
        xml.writeEndElement();
    }

    static String format(BigDecimal value) {
        if (value == null) {
            return "0.00";
        }
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
