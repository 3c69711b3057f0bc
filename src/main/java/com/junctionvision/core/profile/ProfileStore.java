package com.junctionvision.core.profile;

import java.util.Optional;

/**
 * Хранилище профилей. {@link #upsert} - единственная точка изменения и атомарна
 * для одного номера: два параллельных вызова дают count+2, а не count+1.
 * Сбои - {@link ProfileStoreException}.
 */
public interface ProfileStore {

    Optional<ProfileAggregate> get(String plate);

    ProfileAggregate upsert(String plate, String violationId);
}
