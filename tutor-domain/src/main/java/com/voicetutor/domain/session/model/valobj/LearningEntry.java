package com.voicetutor.domain.session.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 学习入口：一个可以开启会话的主题。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearningEntry {

    private String entryId;
    private String domain;
    private String title;
    private String subtitle;
    /** 本主题可出场的角色，空则使用全局配置 */
    @Builder.Default
    private List<String> roles = new ArrayList<>();
    /** 主题的核心比喻，填充节拍模板中的 {metaphor} */
    private String metaphor;
    /** 开场诊断题 */
    @Builder.Default
    private List<QuizQuestion> diagnoseQuestions = new ArrayList<>();
}
