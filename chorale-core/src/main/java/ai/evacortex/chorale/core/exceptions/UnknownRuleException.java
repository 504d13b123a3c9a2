/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.exceptions;

public class UnknownRuleException extends ChoraleException {
    public UnknownRuleException(String message) {
        super("Unknown rule: " + message);
    }

    public UnknownRuleException(String message, Throwable cause) {
        super("Unknown rule: " + message, cause);
    }
}
