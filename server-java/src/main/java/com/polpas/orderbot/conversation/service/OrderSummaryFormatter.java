package com.polpas.orderbot.conversation.service;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Customer-facing texts that list products, kept in one place so reminders and
 * confirmations render the order the same way.
 */
@Component
public class OrderSummaryFormatter {

    public String summary(Map<String, Integer> orders) {
        StringBuilder summary = new StringBuilder("📋 **RESUMO DO SEU PEDIDO:**\n");
        orders.forEach((product, quantity) -> {
            if (quantity > 0) {
                summary.append("• ").append(product).append(": ").append(quantity).append('\n');
            }
        });
        summary.append("\n⚠️ **Confirma o pedido?** (responda com 'confirmar' ou 'nao')");
        return summary.toString();
    }

    public String reminder(int reminderIndex, int maxReminders, Map<String, Integer> orders) {
        return "🔔 **LEMBRETE (%d/%d):**\n%s".formatted(reminderIndex, maxReminders, summary(orders));
    }

    public String confirmed(Map<String, Integer> orders) {
        StringBuilder response = new StringBuilder("✅ **PEDIDO CONFIRMADO COM SUCESSO!**\n\n**Itens confirmados:**\n");
        orders.forEach((product, quantity) -> {
            if (quantity > 0) {
                response.append("• ").append(quantity).append("x ").append(product).append('\n');
            }
        });
        response.append("\nObrigado pelo pedido! 🎉");
        return response.toString();
    }

    public String held(Map<String, Integer> orders) {
        StringBuilder notice = new StringBuilder("⏸️ **PEDIDO EM ESPERA** - Não recebemos sua confirmação.\n");
        orders.forEach((product, quantity) ->
                notice.append("• ").append(product).append(": ").append(quantity).append('\n'));
        notice.append("\nDigite 'confirmar' para confirmar ou 'nao' para descartar.");
        return notice.toString();
    }
}
