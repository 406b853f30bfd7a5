package com.voicetutor.domain.timeline.model.entity;

import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.types.enums.EventTypeEnum;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;

/**
 * 时间线事件实体。
 * <p>
 * 一旦追加到时间线便不再修改；仓储在写入与读取时都做拷贝。
 * {@code seq} 由仓储分配，{@code serverTimestamp} 由编排层写入。
 * </p>
 */
@Data
public class TimelineEventEntity {

    private Long seq;
    private String sessionId;
    /** 调用方提供的幂等键，可为空 */
    private String eventId;
    private String turnId;
    /** 事件类型编码，见 {@link EventTypeEnum}，允许扩展 */
    private String type;
    private String text;
    private String questionId;
    private String answer;
    private LocalDateTime clientTimestamp;
    private LocalDateTime serverTimestamp;
    /** 仅 director_plan 事件携带 */
    private DirectorPlan directorPlan;

    public static TimelineEventEntity of(EventTypeEnum type, String text) {
        TimelineEventEntity event = new TimelineEventEntity();
        event.setType(type.getCode());
        event.setText(text);
        return event;
    }

    public EventTypeEnum resolveType() {
        return EventTypeEnum.fromCode(type);
    }

    public boolean isType(EventTypeEnum expected) {
        return expected != null && expected == resolveType();
    }

    public boolean hasEventId() {
        return StringUtils.isNotBlank(eventId);
    }

    /**
     * 对导演而言的“用户最新输入”：答题事件取答案，其余取文本。
     */
    public String userText() {
        if (isType(EventTypeEnum.QUIZ_ANSWER)) {
            return StringUtils.defaultString(answer);
        }
        return StringUtils.defaultString(text);
    }

    public TimelineEventEntity copy() {
        TimelineEventEntity copy = new TimelineEventEntity();
        copy.setSeq(seq);
        copy.setSessionId(sessionId);
        copy.setEventId(eventId);
        copy.setTurnId(turnId);
        copy.setType(type);
        copy.setText(text);
        copy.setQuestionId(questionId);
        copy.setAnswer(answer);
        copy.setClientTimestamp(clientTimestamp);
        copy.setServerTimestamp(serverTimestamp);
        copy.setDirectorPlan(directorPlan == null ? null : directorPlan.copy());
        return copy;
    }
}
