package com.voicetutor.infrastructure.repository.session;

import com.voicetutor.domain.session.adapter.repository.ILearningEntryRepository;
import com.voicetutor.domain.session.model.valobj.LearningEntry;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 配置驱动的学习入口目录，启动后只读。
 */
public class InMemoryLearningEntryRepository implements ILearningEntryRepository {

    private final Map<String, LearningEntry> entries;

    public InMemoryLearningEntryRepository(List<LearningEntry> entries) {
        Map<String, LearningEntry> indexed = new LinkedHashMap<>();
        if (entries != null) {
            for (LearningEntry entry : entries) {
                if (entry != null && StringUtils.isNotBlank(entry.getEntryId())) {
                    indexed.put(entry.getEntryId(), entry);
                }
            }
        }
        this.entries = Collections.unmodifiableMap(indexed);
    }

    @Override
    public List<LearningEntry> findAll() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public LearningEntry findById(String entryId) {
        return entryId == null ? null : entries.get(entryId);
    }
}
