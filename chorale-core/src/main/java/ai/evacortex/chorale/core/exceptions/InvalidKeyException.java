/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.exceptions;

public class InvalidKeyException extends ChoraleException {
    public InvalidKeyException(String message) {
        super("Invalid key: " + message);
    }

    public InvalidKeyException(String message, Throwable cause) {
        super("Invalid key: " + message, cause);
    }
}
