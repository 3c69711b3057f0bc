package com.junctionvision.core.pipeline;

/**
 * Итог обработки одного нарушения.
 * profileError != null - профиль не обновлён, но запись всё равно отправлена в приёмник.
 */
public record ViolationOutcome(ViolationRecord record, boolean profileUpdated, boolean submitted, String profileError) {

    public boolean isClean() {
        return profileUpdated && submitted;
    }
}
