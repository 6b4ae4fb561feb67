package com.motionflow.orchestrator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Stand-in for the notification service: records each workflow event.
 * Customer emails are never logged in full.
 */
@Component
class NotificationLogListener {

    private static final Logger log = LoggerFactory.getLogger(NotificationLogListener.class);

    @Async
    @EventListener
    void onWorkflowEvent(WorkflowEvent e) {
        log.info("Workflow event {} for order {} ({}) -> {} documents={} attributes={}",
                e.type(), e.orderNumber(), e.motionType(), mask(e.recipient()), e.documents(), e.attributes());
    }

    static String mask(String email) {
        if (email == null) return null;
        int at = email.indexOf('@');
        if (at <= 1) return "***" + (at >= 0 ? email.substring(at) : "");
        return email.charAt(0) + "***" + email.substring(at);
    }
}
