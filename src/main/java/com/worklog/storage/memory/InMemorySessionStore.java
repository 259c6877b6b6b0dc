package com.worklog.storage.memory;

import com.worklog.model.WorkDay;
import com.worklog.storage.SessionStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySessionStore implements SessionStore {

    private final Map<String, List<WorkDay>> byOwner = new ConcurrentHashMap<>();

    @Override
    public Optional<WorkDay> load(String ownerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        List<WorkDay> days = byOwner.getOrDefault(ownerId, List.of());
        return days.isEmpty() ? Optional.empty() : Optional.of(days.get(days.size() - 1));
    }

    @Override
    public Optional<WorkDay> loadById(String ownerId, UUID workDayId) {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(workDayId, "workDayId");
        return byOwner.getOrDefault(ownerId, List.of()).stream()
                .filter(day -> day.id().equals(workDayId))
                .findFirst();
    }

    @Override
    public List<WorkDay> history(String ownerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        return byOwner.getOrDefault(ownerId, List.of());
    }

    @Override
    public void save(WorkDay workDay) {
        Objects.requireNonNull(workDay, "workDay");
        byOwner.compute(workDay.ownerId(), (owner, existing) -> {
            List<WorkDay> updated = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            boolean replaced = false;
            for (int i = 0; i < updated.size(); i++) {
                if (updated.get(i).id().equals(workDay.id())) {
                    updated.set(i, workDay);
                    replaced = true;
                    break;
                }
            }
            if (!replaced) {
                updated.add(workDay);
            }
            return List.copyOf(updated);
        });
    }
}
