package com.agile.Buro.Service;

import com.agile.Buro.Config.BuroProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.io.UnsupportedEncodingException;

@Service
@RequiredArgsConstructor
public class EmailService {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final BuroProperties properties;

    /** Mail goes out only when enabled and a mail host is configured. */
    public boolean isEnabled() {
        return properties.getMail().isEnabled() && mailSender.getIfAvailable() != null;
    }

    // Issue assigned / status changed
    public void sendNotification(String to, String subject, String body) {
        String html = """
      <div style="font-family: Arial, sans-serif; background:#f6f7fb; padding:24px;">
        <div style="max-width:560px; margin:0 auto; background:#ffffff; border-radius:14px; overflow:hidden; box-shadow:0 6px 20px rgba(0,0,0,0.06);">
          <div style="padding:28px 28px 8px;">
            <h2 style="margin:0 0 8px; font-size:20px; color:#111827;">%s</h2>
          </div>
          <div style="padding:8px 28px 20px;">
            <p style="margin:0; color:#374151; white-space:pre-line;">%s</p>
          </div>
          <div style="padding:0 28px 20px;">
            <a href="%s" style="display:inline-block; text-decoration:none; padding:12px 18px; border-radius:10px; background:#3b82f6; color:#ffffff; font-weight:600;">
              Open Buro
            </a>
          </div>
          <hr style="border:none; border-top:1px solid #e5e7eb; margin:0;">
          <div style="padding:16px 28px; color:#9ca3af; font-size:12px;">
            <p style="margin:0;">You receive this because you are involved in the issue.</p>
          </div>
        </div>
      </div>
    """.formatted(HtmlUtils.htmlEscape(subject), HtmlUtils.htmlEscape(body), properties.getMail().getFrontendUrl());

        sendHtml(to, subject, html);
    }

    // Registration
    public void sendWelcome(String to, String fullName) {
        String subject = "Welcome to Buro";
        String safeName = HtmlUtils.htmlEscape(fullName != null ? fullName : "");
        String html = """
      <div style="font-family: Arial, sans-serif; background:#f6f7fb; padding:24px;">
        <div style="max-width:560px; margin:0 auto; background:#ffffff; border-radius:14px; overflow:hidden; box-shadow:0 6px 20px rgba(0,0,0,0.06);">
          <div style="padding:28px;">
            <h1 style="margin:0 0 6px; font-size:24px; color:#111827;">Welcome to Buro</h1>
            <p style="margin:0; color:#6b7280;">Hi <strong style="color:#111827;">%s</strong>, your account has been created.</p>
          </div>
          <div style="padding:0 28px 20px;">
            <p style="margin:0 0 12px; color:#374151;">
              Sign in to see your projects and the Kanban board.
            </p>
            <a href="%s/login" style="display:inline-block; text-decoration:none; padding:12px 18px; border-radius:10px; background:#10b981; color:#ffffff; font-weight:600;">
              Go to Sign in
            </a>
          </div>
        </div>
      </div>
    """.formatted(safeName, properties.getMail().getFrontendUrl());

        sendHtml(to, subject, html);
    }

    private void sendHtml(String to, String subject, String html) {
        JavaMailSender sender = mailSender.getObject();
        try {
            MimeMessage msg = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(msg, "UTF-8");
            helper.setTo(to);
            helper.setFrom(properties.getMail().getFrom(), "Buro");
            helper.setSubject(subject);
            helper.setText(html, true);
            sender.send(msg);
        } catch (MessagingException | UnsupportedEncodingException e) {
            throw new MailPreparationException("Failed to build email to " + to, e);
        }
    }
}
