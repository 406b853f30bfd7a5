package com.voicetutor.domain.session.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 诊断选择题。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuizQuestion {

    private String questionId;
    private String prompt;
    private List<String> options = new ArrayList<>();
}
