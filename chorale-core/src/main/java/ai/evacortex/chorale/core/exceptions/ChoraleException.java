/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.exceptions;

public class ChoraleException extends RuntimeException {
    public ChoraleException(String message) {
        super(message);
    }

    public ChoraleException(String message, Throwable cause) {
        super(message, cause);
    }
}
