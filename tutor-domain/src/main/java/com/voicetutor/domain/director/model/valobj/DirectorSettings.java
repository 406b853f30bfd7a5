package com.voicetutor.domain.director.model.valobj;

import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 导演配置。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DirectorSettings {

    @Builder.Default
    private List<String> availableRoles = new ArrayList<>(List.of("host", "economist", "skeptic"));

    @Builder.Default
    private List<String> availableBeats = BeatLibrary.defaultBeats();

    /** 输出时钟达到该秒数时强制产出型节拍 */
    @Builder.Default
    private long outputClockThresholdSec = 90L;

    @Builder.Default
    private int defaultTalkBurstLimitSec = 20;

    @Builder.Default
    private int highLoadTalkBurstLimitSec = 15;

    /** 张力或负荷高于该值视为高负荷 */
    @Builder.Default
    private int highLevelThreshold = 7;

    /** 张力或负荷低于该值视为偏低 */
    @Builder.Default
    private int lowLevelThreshold = 4;

    public static DirectorSettings defaults() {
        return DirectorSettings.builder().build();
    }

    /**
     * 会话配置了角色时优先使用会话角色。
     */
    public List<String> resolveRoles(SessionStateEntity state) {
        if (state != null && state.getAvailableRoles() != null && !state.getAvailableRoles().isEmpty()) {
            return state.getAvailableRoles();
        }
        return availableRoles == null ? new ArrayList<>() : availableRoles;
    }
}
