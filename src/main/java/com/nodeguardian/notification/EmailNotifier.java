package com.nodeguardian.notification;

import com.nodeguardian.domain.enums.ChannelType;
import com.nodeguardian.exception.NotificationException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Sends alerts as HTML mail with subject {@code [SEVERITY] title}.
 *
 * <p>Needs {@code spring.mail.*} to be configured (so a {@link JavaMailSender} exists) and
 * {@code notifications.email.enabled=true}. Recipients come from the channel's {@code to} or
 * {@code notifications.email.to}.
 */
@Component
public class EmailNotifier implements NotificationTransport {

    private static final Logger log = LoggerFactory.getLogger(EmailNotifier.class);

    private final NotificationConfig notificationConfig;
    private final ObjectProvider<JavaMailSender> mailSenderProvider;

    public EmailNotifier(NotificationConfig notificationConfig, ObjectProvider<JavaMailSender> mailSenderProvider) {
        this.notificationConfig = notificationConfig;
        this.mailSenderProvider = mailSenderProvider;
    }

    @Override
    public ChannelType getType() {
        return ChannelType.EMAIL;
    }

    @Override
    public void send(ChannelConfig channel, AlertMessage message) {
        NotificationConfig.Email email = notificationConfig.getEmail();
        if (!email.isEnabled()) {
            throw new NotificationException("Email notifications are disabled");
        }
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            throw new NotificationException("No mail sender configured (spring.mail.host)");
        }
        List<String> recipients = channel.getTo() != null && !channel.getTo().isEmpty() ? channel.getTo() : email.getTo();
        if (recipients.isEmpty()) {
            throw new NotificationException("No email recipients configured");
        }

        try {
            MimeMessage mime = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, false, "UTF-8");
            helper.setFrom(email.getFrom());
            helper.setTo(recipients.toArray(String[]::new));
            helper.setSubject(subject(message));
            helper.setText(html(message), true);
            mailSender.send(mime);
            log.debug("Email alert sent to {}", recipients);
        } catch (MessagingException | MailException e) {
            throw new NotificationException("Email delivery failed: " + e.getMessage(), e);
        }
    }

    String subject(AlertMessage message) {
        return "[" + message.getSeverity().name() + "] " + message.getTitle();
    }

    String html(AlertMessage message) {
        String description = message.getDescription() != null ? message.getDescription() : "";
        return "<html><body>"
                + "<h2>" + HtmlUtils.htmlEscape(message.getTitle()) + "</h2>"
                + "<p>" + HtmlUtils.htmlEscape(message.getSummary() != null ? message.getSummary() : "") + "</p>"
                + "<pre>" + HtmlUtils.htmlEscape(description) + "</pre>"
                + "<p><b>Rule:</b> " + HtmlUtils.htmlEscape(message.getRuleName()) + "<br/>"
                + "<b>Nodes:</b> " + HtmlUtils.htmlEscape(String.join(", ", message.getTriggeredNodes())) + "<br/>"
                + "<b>Time:</b> " + message.getTimestamp() + "</p>"
                + "</body></html>";
    }
}
