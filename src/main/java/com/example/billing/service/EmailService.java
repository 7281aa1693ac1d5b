package com.example.billing.service;

import java.io.UnsupportedEncodingException;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;

/**
 * Sends plain-text notification emails via SMTP.
 *
 * <p>When email is disabled or no JavaMailSender is configured, requests are only logged. Sending
 * never throws: every outcome is reported through {@link EmailResult}.
 *
 * <p>Configuration: - billing.notifications.email.enabled: Set to true to enable sending -
 * spring.mail.*: Standard Spring Boot mail properties for SMTP - billing.notifications.email.from-address
 * and from-name: Sender
 */
@Service
public class EmailService {

  private static final Logger log = LoggerFactory.getLogger(EmailService.class);

  private final JavaMailSender mailSender;
  private final boolean emailEnabled;
  private final String fromAddress;
  private final String fromName;

  @Autowired
  public EmailService(
      @Autowired(required = false) JavaMailSender mailSender,
      @Value("${billing.notifications.email.enabled:false}") boolean emailEnabled,
      @Value("${billing.notifications.email.from-address:noreply@billing.local}") String fromAddress,
      @Value("${billing.notifications.email.from-name:Billing}") String fromName) {
    this.mailSender = mailSender;
    this.emailEnabled = emailEnabled;
    this.fromAddress = fromAddress;
    this.fromName = fromName;
  }

  /** Result of an email send attempt. */
  public record EmailResult(boolean success, String status, String message, String messageId) {
    public static EmailResult sent(String messageId) {
      return new EmailResult(true, "SENT", "Email sent successfully", messageId);
    }

    public static EmailResult disabled() {
      return new EmailResult(false, "DISABLED", "Email sending is not enabled", null);
    }

    public static EmailResult failed(String reason) {
      return new EmailResult(false, "FAILED", reason, null);
    }

    public static EmailResult invalidRecipient(String reason) {
      return new EmailResult(false, "INVALID_RECIPIENT", reason, null);
    }
  }

  public boolean isEnabled() {
    return emailEnabled && mailSender != null;
  }

  public EmailResult send(String toAddress, String subject, String body) {
    if (toAddress == null || toAddress.isBlank()) {
      return EmailResult.invalidRecipient("No recipient address");
    }
    if (!emailEnabled) {
      log.debug("Email disabled, not sending to {}: {}", toAddress, subject);
      return EmailResult.disabled();
    }
    if (mailSender == null) {
      log.warn(
          "Email enabled but JavaMailSender not configured. Would send to: {} subject: {}",
          toAddress,
          subject);
      return EmailResult.disabled();
    }

    String messageId = UUID.randomUUID().toString();
    try {
      MimeMessage mimeMessage = mailSender.createMimeMessage();
      mimeMessage.setFrom(new InternetAddress(fromAddress, fromName));
      mimeMessage.setRecipient(MimeMessage.RecipientType.TO, new InternetAddress(toAddress));
      mimeMessage.setSubject(subject, "UTF-8");
      mimeMessage.setText(body, "UTF-8");
      mimeMessage.setHeader("X-Billing-Message-ID", messageId);

      mailSender.send(mimeMessage);

      log.info("Email sent [{}]: to={}, subject={}", messageId, toAddress, subject);
      return EmailResult.sent(messageId);

    } catch (MessagingException | UnsupportedEncodingException e) {
      log.error("Failed to build email to {}: {}", toAddress, e.getMessage(), e);
      return EmailResult.invalidRecipient("Invalid email: " + e.getMessage());
    } catch (MailException e) {
      log.error("Failed to send email to {}: {}", toAddress, e.getMessage(), e);
      return EmailResult.failed("Failed to send email: " + e.getMessage());
    }
  }
}
