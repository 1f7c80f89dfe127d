package com.roundtrip.pojo.vo;

import com.roundtrip.pojo.enums.ConflictType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 日期冲突（只读、不落库），每次重算都完整生成。
 * <p>duration_exceeded 类型不对应具体的相邻两站，fromStop/toStop 为 null。</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DateConflictVO {

    private ConflictType type;

    /** 前一站 id */
    private String fromStop;

    /** 后一站 id */
    private String toStop;

    /** 重叠/空档/超出的天数 */
    private Long days;

    /** 面向用户的提示文案 */
    private String message;
}
