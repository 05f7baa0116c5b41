package alertflow.oncall;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 值班安排
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OnCall {
    private String id;
    private String customer;
    private Set<String> userIds = new LinkedHashSet<>();
    private Set<String> groupIds = new LinkedHashSet<>();
    private LocalDate startDate;
    private LocalDate endDate;
    private LocalTime startTime;
    private LocalTime endTime;
    private RepeatType repeatType = RepeatType.NONE;
    private Set<String> repeatDays = new LinkedHashSet<>();     // Mon/Tue/...
    private Set<Integer> repeatWeeks = new LinkedHashSet<>();   // 当月第几周 1-5
    private Set<String> repeatMonths = new LinkedHashSet<>();   // Jan/Feb/...
    private String user;
    private String sourcePath;
}
