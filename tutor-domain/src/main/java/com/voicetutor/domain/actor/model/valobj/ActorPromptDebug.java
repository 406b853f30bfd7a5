package com.voicetutor.domain.actor.model.valobj;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 指令组装调试信息。
 */
@Data
public class ActorPromptDebug {

    private String sessionId;
    private String turnId;
    private String role;
    private String beat;
    private String outputAction;
    private int talkBurstLimitSec;
    private List<String> userMindState = new ArrayList<>();
    /** profile / leading_lines */
    private String roleEssenceSource;
    /** fenced_block / synthesized */
    private String beatGuidanceSource;
    private int length;
    private boolean fallback;
    private String fallbackReason;
}
