package by.greenmobile.retainingwall.controller;

import by.greenmobile.retainingwall.controller.dto.DesignResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Последние ответы по request id. Принадлежит API-слою, движок его не видит.
 * Простой LRU без внешних зависимостей; synchronized, т.к. запросы идут параллельно.
 */
@Component
public class DesignResultStore {

    private final int maxSize;
    private final LinkedHashMap<String, DesignResponse> map;

    public DesignResultStore(@Value("${wall.results.capacity:500}") int capacity) {
        this.maxSize = Math.max(1, capacity);
        this.map = new LinkedHashMap<>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, DesignResponse> eldest) {
                return size() > DesignResultStore.this.maxSize;
            }
        };
    }

    public synchronized void put(String requestId, DesignResponse response) {
        map.put(requestId, response);
    }

    public synchronized Optional<DesignResponse> get(String requestId) {
        return Optional.ofNullable(map.get(requestId));
    }

    public synchronized boolean contains(String requestId) {
        return map.containsKey(requestId);
    }

    public synchronized int size() {
        return map.size();
    }
}
