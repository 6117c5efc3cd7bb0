package com.scoutim.common.mail;

/**
 * 事务邮件出口。实现方负责重试；最终失败时抛 {@link MailSendException}。
 */
public interface MailNotifier {

    /**
     * 发件人/密钥是否已配置；未配置时调用方应跳过发送。
     */
    boolean isConfigured();

    /**
     * @param htmlBody 可为 null，此时只发纯文本
     */
    void send(String toEmail, String subject, String textBody, String htmlBody) throws MailSendException;
}
