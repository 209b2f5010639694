package com.kakomon.harvest;

import com.kakomon.dataset.Dataset;
import com.kakomon.dataset.Question;
import com.kakomon.normalize.QuestionIdentity;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Identities and ids captured by a previous run, used to pre-populate the seen set of resumed sessions.
 */
public final class ResumeState {
    private static final ResumeState NONE = new ResumeState(Map.of(), Map.of(), List.of());

    private final Map<String, Set<String>> identitiesByPrefix;
    private final Map<String, String> idByIdentity;
    private final List<String> ids;

    private ResumeState(Map<String, Set<String>> identitiesByPrefix, Map<String, String> idByIdentity, List<String> ids) {
        this.identitiesByPrefix = identitiesByPrefix;
        this.idByIdentity = idByIdentity;
        this.ids = ids;
    }

    public static ResumeState none() {
        return NONE;
    }

    public static ResumeState from(Dataset dataset) {
        if (dataset == null || dataset.isEmpty()) {
            return NONE;
        }
        Map<String, Set<String>> byPrefix = new HashMap<>();
        Map<String, String> idByIdentity = new HashMap<>();
        for (Question q : dataset.questions.values()) {
            String identity = QuestionIdentity.of(q.text, q.choices);
            byPrefix.computeIfAbsent(prefixOf(q.id), ignored -> new HashSet<>()).add(identity);
            idByIdentity.putIfAbsent(identity, q.id);
        }
        Map<String, Set<String>> frozen = new HashMap<>();
        byPrefix.forEach((prefix, set) -> frozen.put(prefix, Set.copyOf(set)));
        return new ResumeState(Map.copyOf(frozen), Map.copyOf(idByIdentity), List.copyOf(dataset.ids()));
    }

    public Set<String> identitiesFor(String idPrefix) {
        return identitiesByPrefix.getOrDefault(idPrefix, Set.of());
    }

    /**
     * Id the previous run stored for content {@code identity}, if any.
     */
    public Optional<String> idOf(String identity) {
        return Optional.ofNullable(idByIdentity.get(identity));
    }

    public List<String> ids() {
        return ids;
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    static String prefixOf(String id) {
        int idx = id == null ? -1 : id.lastIndexOf("-q");
        return idx <= 0 ? "" : id.substring(0, idx);
    }
}
