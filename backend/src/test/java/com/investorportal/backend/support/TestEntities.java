package com.investorportal.backend.support;

import java.lang.reflect.Field;
import java.util.UUID;

public final class TestEntities {

    private TestEntities() {
    }

    /**
     * Assigns the generated id a persisted entity would carry.
     */
    public static <T> T withId(T entity, UUID id) {
        Class<?> type = entity.getClass();
        while (type != null) {
            try {
                Field idField = type.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(entity, id);
                return entity;
            } catch (NoSuchFieldException ex) {
                type = type.getSuperclass();
            } catch (IllegalAccessException ex) {
                throw new IllegalStateException(ex);
            }
        }
        throw new IllegalArgumentException("No id field on " + entity.getClass());
    }
}
