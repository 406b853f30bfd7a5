package com.voicetutor.config;

import com.voicetutor.domain.session.adapter.repository.ILearningEntryRepository;
import com.voicetutor.domain.session.model.valobj.LearningEntry;
import com.voicetutor.domain.session.model.valobj.QuizQuestion;
import com.voicetutor.infrastructure.repository.session.InMemoryLearningEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 会话相关配置：时钟与学习入口目录。
 *
 * @author voicetutor
 * @since 2026-03-02
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(TutorProperties.class)
public class SessionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ILearningEntryRepository learningEntryRepository(TutorProperties properties) {
        List<LearningEntry> entries = new ArrayList<>();
        for (TutorProperties.Entry entry : properties.getEntries()) {
            entries.add(toEntry(entry));
        }
        if (entries.isEmpty()) {
            log.warn("LEARNING_ENTRIES_EMPTY no entries configured under tutor.entries");
        }
        return new InMemoryLearningEntryRepository(entries);
    }

    private LearningEntry toEntry(TutorProperties.Entry source) {
        List<QuizQuestion> diagnose = new ArrayList<>();
        for (TutorProperties.Question question : source.getDiagnose()) {
            diagnose.add(new QuizQuestion(question.getQuestionId(), question.getPrompt(), new ArrayList<>(question.getOptions())));
        }
        return LearningEntry.builder()
                .entryId(source.getEntryId())
                .domain(source.getDomain())
                .title(source.getTitle())
                .subtitle(source.getSubtitle())
                .roles(new ArrayList<>(source.getRoles()))
                .metaphor(source.getMetaphor())
                .diagnoseQuestions(diagnose)
                .build();
    }
}
