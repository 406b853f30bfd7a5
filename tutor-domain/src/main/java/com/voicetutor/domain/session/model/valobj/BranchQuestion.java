package com.voicetutor.domain.session.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 待回到的分支问题。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BranchQuestion {

    private String questionId;
    private String prompt;
    private LocalDateTime createdAt;
}
