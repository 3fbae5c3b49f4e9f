package com.shortly.backend.modules.auth.infrastructure.mail;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Component
public class VerificationMailSender {

    static final String SUBJECT = "Verify your email";

    private final JavaMailSender mailSender;
    private final String from;

    public VerificationMailSender(JavaMailSender mailSender,
                                  @Value("${app.mail.from:Shortly <no-reply@shortly.local>}") String from) {
        this.mailSender = mailSender;
        this.from = from;
    }

    public void send(String to, String name, String code, String verifyLink) throws MailException {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(to);
        message.setSubject(SUBJECT);
        message.setText("""
                Hello %s,

                Your verification code is: %s

                Or open this link to verify your email address:
                %s

                The code expires in 24 hours.
                """.formatted(name, code, verifyLink));
        mailSender.send(message);
    }
}
