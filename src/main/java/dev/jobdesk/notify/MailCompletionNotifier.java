package dev.jobdesk.notify;

import dev.jobdesk.config.DeskConfig;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Emails completion notices to the configured recipients (normally the
 * department supervisors).
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "desk.notify.mail", havingValue = "true")
public class MailCompletionNotifier implements CompletionNotifier {

    private final JavaMailSender mailSender;
    private final TemplateEngine templateEngine;
    private final DeskConfig deskConfig;

    @Override
    public Mono<Boolean> jobCompleted(CompletionNotice notice) {
        return Mono.fromCallable(() -> {
            if (deskConfig.getNotify().getTo().isEmpty()) {
                log.warn("No completion recipients configured - notice for {} not sent", notice.jobNumber());
                return false;
            }
            try {
                MimeMessage message = mailSender.createMimeMessage();
                MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");

                helper.setFrom(deskConfig.getNotify().getFrom());
                helper.setTo(deskConfig.getNotify().getTo().toArray(String[]::new));
                helper.setSubject(String.format("Job %s completed", notice.jobNumber()));
                helper.setText(render(notice), true);

                mailSender.send(message);
                log.info("Completion notice for {} sent to {}", notice.jobNumber(), deskConfig.getNotify().getTo());
                return true;

            } catch (MessagingException | MailException e) {
                log.error("Failed to send completion notice for {}: {}", notice.jobNumber(), e.getMessage(), e);
                return false;
            }
        });
    }

    private String render(CompletionNotice notice) {
        Context context = new Context(Locale.getDefault());
        context.setVariable("notice", notice);
        return templateEngine.process("email/job-completed", context);
    }
}
