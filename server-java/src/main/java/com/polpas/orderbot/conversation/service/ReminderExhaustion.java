package com.polpas.orderbot.conversation.service;

/**
 * What happens to an order when every reminder went unanswered.
 */
public enum ReminderExhaustion {
    /** Save it as its own auto-confirmed group and start over. */
    AUTO_CONFIRM,
    /** Keep it as a pending order and ask for an explicit yes or no. */
    HOLD_PENDING
}
