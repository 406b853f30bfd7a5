package com.voicetutor.domain.director.model.valobj;

import com.voicetutor.types.enums.UserMustDoTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 学习者本轮必须产出的内容。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserMustDo {

    private UserMustDoTypeEnum type;
    private String prompt;

    public UserMustDo copy() {
        return new UserMustDo(type, prompt);
    }
}
