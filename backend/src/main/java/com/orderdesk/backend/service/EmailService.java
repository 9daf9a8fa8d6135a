package com.orderdesk.backend.service;

import com.orderdesk.backend.exception.OperationFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.util.List;
import java.util.Map;

/**
 * Sends one-time codes through the Brevo transactional email HTTP API.
 */
@Slf4j
@Service
public class EmailService {

  private final WebClient webClient;

  @Value("${app.brevo.apiKey:}")
  private String brevoApiKey;

  @Value("${app.brevo.senderEmail:no-reply@orderdesk.local}")
  private String senderEmail;

  @Value("${app.brevo.senderName:Order Desk}")
  private String senderName;

  @Value("${app.otp.ttl-minutes:10}")
  private long codeTtlMinutes;

  public EmailService(WebClient.Builder webClientBuilder,
                      @Value("${app.brevo.baseUrl:https://api.brevo.com/v3}") String baseUrl) {
    this.webClient = webClientBuilder
        .baseUrl(baseUrl)
        .build();
  }

  public void sendVerificationCode(String to, String code) {
    send(to, "Order Desk: verify your email",
        buildCodeEmailHtml("Verify Your Email",
            "Use the code below to confirm your email address.", code));
  }

  public void sendPasswordResetCode(String to, String code) {
    send(to, "Order Desk: password reset code",
        buildCodeEmailHtml("Reset Your Password",
            "Use the code below to choose a new password. If you did not ask for a reset, ignore this email.", code));
  }

  private void send(String to, String subject, String html) {
    try {
      Map<String, Object> emailPayload = Map.of(
          "sender", Map.of("name", senderName, "email", senderEmail),
          "to", List.of(Map.of("email", to)),
          "subject", subject,
          "htmlContent", html);

      String response = webClient.post()
          .uri("/smtp/email")
          .header("api-key", brevoApiKey)
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .bodyValue(emailPayload)
          .retrieve()
          .bodyToMono(String.class)
          .block();

      log.info("Email '{}' sent to: {} | Response: {}", subject, to, response);
    } catch (WebClientException e) {
      log.error("Failed to send email to {}: {}", to, e.getMessage());
      throw new OperationFailedException("Failed to send email. Please try again.", e);
    }
  }

  private String buildCodeEmailHtml(String heading, String intro, String code) {
    return """
        <!DOCTYPE html>
        <html>
        <head>
          <meta charset="UTF-8">
        </head>
        <body style="margin:0;padding:0;font-family:'Segoe UI',Tahoma,Geneva,Verdana,sans-serif;background-color:#f4f5f7;">
          <table role="presentation" width="100%%" cellpadding="0" cellspacing="0" style="padding:40px 20px;">
            <tr>
              <td align="center">
                <table role="presentation" width="480" cellpadding="0" cellspacing="0" style="background:#ffffff;border-radius:12px;border:1px solid #e2e5ea;">
                  <tr>
                    <td style="padding:32px 40px;">
                      <h2 style="color:#1f2937;margin:0 0 12px;font-size:20px;">%s</h2>
                      <p style="color:#4b5563;margin:0 0 24px;font-size:15px;line-height:1.6;">%s
                        The code expires in <strong>%d minutes</strong>.</p>
                      <div style="background:#eef2ff;border-radius:8px;padding:20px;text-align:center;">
                        <span style="font-size:32px;font-weight:700;letter-spacing:10px;color:#3730a3;font-family:'Courier New',monospace;">%s</span>
                      </div>
                    </td>
                  </tr>
                </table>
              </td>
            </tr>
          </table>
        </body>
        </html>
        """
        .formatted(heading, intro, codeTtlMinutes, code);
  }
}
