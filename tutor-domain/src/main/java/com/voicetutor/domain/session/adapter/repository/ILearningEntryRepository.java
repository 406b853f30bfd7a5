package com.voicetutor.domain.session.adapter.repository;

import com.voicetutor.domain.session.model.valobj.LearningEntry;

import java.util.List;

/**
 * 学习入口目录。
 */
public interface ILearningEntryRepository {

    List<LearningEntry> findAll();

    /**
     * 按入口 ID 查询，不存在返回 null。
     */
    LearningEntry findById(String entryId);
}
