package com.example.billing.service;

import com.example.billing.exception.DocumentRenderingException;
import com.lowagie.text.*;
import com.lowagie.text.pdf.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Service for rendering invoice PDFs from an {@link InvoiceExport}.
 * Lays out the customer block, line items, a tax breakdown per rate and the
 * payment position.
 */
@Service
public class InvoicePdfService {

    private static final Logger log = LoggerFactory.getLogger(InvoicePdfService.class);

    // Fonts
    private static final Font TITLE_FONT = new Font(Font.HELVETICA, 24, Font.BOLD, new Color(52, 73, 94));
    private static final Font NORMAL_FONT = new Font(Font.HELVETICA, 10, Font.NORMAL);
    private static final Font BOLD_FONT = new Font(Font.HELVETICA, 10, Font.BOLD);
    private static final Font SMALL_FONT = new Font(Font.HELVETICA, 8, Font.NORMAL);
    private static final Font SMALL_BOLD_FONT = new Font(Font.HELVETICA, 8, Font.BOLD);
    private static final Font TABLE_HEADER_FONT = new Font(Font.HELVETICA, 9, Font.BOLD, Color.WHITE);
    private static final Font TABLE_CELL_FONT = new Font(Font.HELVETICA, 9, Font.NORMAL);

    // Colors
    private static final Color PRIMARY_COLOR = new Color(52, 73, 94);
    private static final Color ACCENT_COLOR = new Color(41, 128, 185);
    private static final Color ALT_ROW_BG = new Color(245, 247, 249);
    private static final Color LIGHT_BLUE_BG = new Color(235, 245, 251);
    private static final Color SUCCESS_GREEN = new Color(39, 174, 96);
    private static final Color WARNING_RED = new Color(231, 76, 60);

    private final DateTimeFormatter dateFormatter = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    /**
     * Renders the invoice as an A4 PDF.
     *
     * @return the PDF content
     * @throws DocumentRenderingException if the document could not be built
     */
    public byte[] render(InvoiceExport invoice) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            Document document = new Document(PageSize.A4, 50, 50, 50, 50);
            PdfWriter.getInstance(document, baos);
            document.open();

            addHeader(document, invoice);
            addCustomerSection(document, invoice.customer());
            addInvoiceDetails(document, invoice);
            addLineItemsTable(document, invoice);
            addTotalsSection(document, invoice);
            addFooter(document, invoice);

            document.close();

            log.info("Generated invoice PDF for invoice {}: {} bytes", invoice.invoiceNumber(), baos.size());
            return baos.toByteArray();

        } catch (DocumentException | IOException e) {
            log.error("Failed to generate invoice PDF for {}", invoice.invoiceNumber(), e);
            throw new DocumentRenderingException("Failed to generate invoice PDF for "
                + invoice.invoiceNumber() + ": " + e.getMessage(), e);
        }
    }

    private void addHeader(Document document, InvoiceExport invoice) throws DocumentException {
        Paragraph title = new Paragraph("INVOICE", TITLE_FONT);
        title.setAlignment(Element.ALIGN_RIGHT);
        document.add(title);

        Color statusColor = switch (invoice.status()) {
            case "PAID" -> SUCCESS_GREEN;
            case "CANCELLED" -> WARNING_RED;
            case "SENT" -> ACCENT_COLOR;
            default -> Color.GRAY;
        };
        Paragraph status = new Paragraph(invoice.status(), new Font(Font.HELVETICA, 11, Font.BOLD, statusColor));
        status.setAlignment(Element.ALIGN_RIGHT);
        status.setSpacingAfter(20);
        document.add(status);
    }

    private void addCustomerSection(Document document, InvoiceExport.Party customer) throws DocumentException {
        PdfPTable table = new PdfPTable(1);
        table.setWidthPercentage(50);
        table.setHorizontalAlignment(Element.ALIGN_LEFT);
        table.setSpacingAfter(15);

        PdfPCell cell = new PdfPCell();
        cell.setBackgroundColor(LIGHT_BLUE_BG);
        cell.setPadding(10);
        cell.setBorderColor(ACCENT_COLOR);

        cell.addElement(new Paragraph("BILL TO", SMALL_BOLD_FONT));
        cell.addElement(new Paragraph(customer.name(), BOLD_FONT));

        if (hasText(customer.taxNumber())) {
            String taxLine = "Tax No: " + customer.taxNumber();
            if (hasText(customer.taxOffice())) {
                taxLine = customer.taxOffice() + " / " + taxLine;
            }
            cell.addElement(new Paragraph(taxLine, SMALL_FONT));
        }
        if (hasText(customer.address())) {
            String address = hasText(customer.city()) ? customer.address() + ", " + customer.city() : customer.address();
            Paragraph addressPara = new Paragraph(address, SMALL_FONT);
            addressPara.setSpacingBefore(5);
            cell.addElement(addressPara);
        }
        if (hasText(customer.email())) {
            cell.addElement(new Paragraph(customer.email(), SMALL_FONT));
        }

        table.addCell(cell);
        document.add(table);
    }

    private void addInvoiceDetails(Document document, InvoiceExport invoice) throws DocumentException {
        PdfPTable table = new PdfPTable(3);
        table.setWidthPercentage(100);
        table.setSpacingAfter(20);

        addDetailBox(table, "Invoice Number", invoice.invoiceNumber());
        addDetailBox(table, "Invoice Date", invoice.invoiceDate().format(dateFormatter));
        addDetailBox(table, "Due Date", invoice.dueDate() != null ? invoice.dueDate().format(dateFormatter) : "-");

        document.add(table);
    }

    private void addDetailBox(PdfPTable table, String label, String value) {
        PdfPCell cell = new PdfPCell();
        cell.setBorderColor(Color.LIGHT_GRAY);
        cell.setPadding(8);

        Paragraph labelPara = new Paragraph(label, SMALL_FONT);
        labelPara.setSpacingAfter(3);
        cell.addElement(labelPara);
        cell.addElement(new Paragraph(value, BOLD_FONT));

        table.addCell(cell);
    }

    private void addLineItemsTable(Document document, InvoiceExport invoice) throws DocumentException {
        PdfPTable table = new PdfPTable(7);
        table.setWidthPercentage(100);
        table.setWidths(new float[]{6, 32, 10, 14, 8, 14, 16});
        table.setSpacingAfter(10);

        addTableHeader(table, "#");
        addTableHeader(table, "Description");
        addTableHeader(table, "Qty");
        addTableHeader(table, "Unit Price");
        addTableHeader(table, "Tax %");
        addTableHeader(table, "Tax");
        addTableHeader(table, "Amount");

        boolean alternate = false;
        for (InvoiceExport.Line line : invoice.lines()) {
            Color bgColor = alternate ? ALT_ROW_BG : Color.WHITE;
            alternate = !alternate;

            addTableCell(table, String.valueOf(line.lineNumber()), bgColor, Element.ALIGN_CENTER);
            addTableCell(table, line.description(), bgColor, Element.ALIGN_LEFT);
            addTableCell(table, formatQuantity(line.quantity()), bgColor, Element.ALIGN_CENTER);
            addTableCell(table, formatAmount(line.unitPrice()), bgColor, Element.ALIGN_RIGHT);
            addTableCell(table, line.taxRate() + "%", bgColor, Element.ALIGN_CENTER);
            addTableCell(table, formatAmount(line.taxAmount()), bgColor, Element.ALIGN_RIGHT);
            addTableCell(table, formatAmount(line.lineTotal()), bgColor, Element.ALIGN_RIGHT);
        }

        document.add(table);
    }

    private void addTotalsSection(Document document, InvoiceExport invoice) throws DocumentException {
        PdfPTable table = new PdfPTable(2);
        table.setWidthPercentage(45);
        table.setHorizontalAlignment(Element.ALIGN_RIGHT);
        table.setWidths(new float[]{60, 40});
        table.setSpacingAfter(20);

        addTotalRow(table, "Subtotal", invoice.subtotal(), false);
        for (InvoiceExport.TaxGroup group : invoice.taxGroups()) {
            if (group.taxAmount().signum() > 0) {
                addTotalRow(table, "Tax " + group.rate() + "%", group.taxAmount(), false);
            }
        }
        addTotalRow(table, "TOTAL", invoice.total(), true);

        if (invoice.amountPaid() != null && invoice.amountPaid().signum() > 0) {
            addTotalRow(table, "Amount Paid", invoice.amountPaid().negate(), false);
            addTotalRow(table, "BALANCE DUE", invoice.remainingAmount(), true);
        }

        document.add(table);
    }

    private void addTotalRow(PdfPTable table, String label, BigDecimal amount, boolean isTotal) {
        Font font = isTotal ? BOLD_FONT : NORMAL_FONT;
        Color bgColor = isTotal ? LIGHT_BLUE_BG : Color.WHITE;

        PdfPCell labelCell = new PdfPCell(new Phrase(label, font));
        labelCell.setBorder(Rectangle.TOP);
        labelCell.setBorderColor(Color.LIGHT_GRAY);
        labelCell.setBackgroundColor(bgColor);
        labelCell.setPadding(8);
        labelCell.setHorizontalAlignment(Element.ALIGN_RIGHT);
        table.addCell(labelCell);

        PdfPCell amountCell = new PdfPCell(new Phrase(formatAmount(amount), font));
        amountCell.setBorder(Rectangle.TOP);
        amountCell.setBorderColor(Color.LIGHT_GRAY);
        amountCell.setBackgroundColor(bgColor);
        amountCell.setPadding(8);
        amountCell.setHorizontalAlignment(Element.ALIGN_RIGHT);
        table.addCell(amountCell);
    }

    private void addFooter(Document document, InvoiceExport invoice) throws DocumentException {
        if ("PAID".equals(invoice.status())) {
            Paragraph paid = new Paragraph("PAID IN FULL", new Font(Font.HELVETICA, 14, Font.BOLD, SUCCESS_GREEN));
            paid.setAlignment(Element.ALIGN_CENTER);
            paid.setSpacingBefore(10);
            paid.setSpacingAfter(20);
            document.add(paid);
        }

        if (hasText(invoice.notes())) {
            Paragraph notesTitle = new Paragraph("Notes:", SMALL_BOLD_FONT);
            notesTitle.setSpacingBefore(10);
            document.add(notesTitle);
            document.add(new Paragraph(invoice.notes(), SMALL_FONT));
        }

        Paragraph footer = new Paragraph("Generated on " + LocalDate.now().format(dateFormatter), SMALL_FONT);
        footer.setAlignment(Element.ALIGN_CENTER);
        footer.setSpacingBefore(20);
        document.add(footer);
    }

    private void addTableHeader(PdfPTable table, String text) {
        PdfPCell cell = new PdfPCell(new Phrase(text, TABLE_HEADER_FONT));
        cell.setBackgroundColor(PRIMARY_COLOR);
        cell.setPadding(8);
        cell.setHorizontalAlignment(Element.ALIGN_CENTER);
        table.addCell(cell);
    }

    private void addTableCell(PdfPTable table, String text, Color bgColor, int alignment) {
        PdfPCell cell = new PdfPCell(new Phrase(text, TABLE_CELL_FONT));
        cell.setBackgroundColor(bgColor);
        cell.setPadding(6);
        cell.setHorizontalAlignment(alignment);
        cell.setBorderColor(Color.LIGHT_GRAY);
        table.addCell(cell);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private String formatAmount(BigDecimal amount) {
        if (amount == null) return "0.00";
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private String formatQuantity(BigDecimal qty) {
        if (qty == null) return "0";
        return qty.stripTrailingZeros().toPlainString();
    }
}
