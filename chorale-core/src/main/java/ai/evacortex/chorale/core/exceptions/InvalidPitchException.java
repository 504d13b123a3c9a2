/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.exceptions;

public class InvalidPitchException extends ChoraleException {
    public InvalidPitchException(String message) {
        super("Invalid pitch: " + message);
    }

    public InvalidPitchException(String message, Throwable cause) {
        super("Invalid pitch: " + message, cause);
    }
}
