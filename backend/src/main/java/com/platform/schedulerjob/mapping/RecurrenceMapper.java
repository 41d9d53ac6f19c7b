package com.platform.schedulerjob.mapping;

import com.platform.schedulerjob.model.MonthlyOccurrenceSpec;
import com.platform.schedulerjob.model.RecurrenceSpec;
import com.platform.schedulerjob.model.ScheduleSpec;
import com.platform.schedulerjob.remote.SchedulerJobModels.JobRecurrence;
import com.platform.schedulerjob.remote.SchedulerJobModels.JobRecurrenceSchedule;
import com.platform.schedulerjob.remote.SchedulerJobModels.MonthlyOccurrence;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps the recurrence block to and from the recurrence payload.
 *
 * <p>The schedule object is attached only when at least one of its collections holds a
 * value. The service does not answer an empty schedule object with a usable error.
 */
public final class RecurrenceMapper {
    
    private RecurrenceMapper() {
    }
    
    public static JobRecurrence encode(RecurrenceSpec recurrence) {
        JobRecurrence payload = new JobRecurrence();
        payload.setFrequency(recurrence.frequency());
        payload.setInterval(recurrence.interval());
        if (recurrence.count() != null) {
            payload.setCount(recurrence.count());
        }
        if (recurrence.endTime() != null) {
            payload.setEndTime(recurrence.endTime());
        }
        payload.setSchedule(encodeSchedule(recurrence.schedule()));
        return payload;
    }
    
    /**
     * @return the schedule payload, or {@code null} when every collection is empty
     */
    static JobRecurrenceSchedule encodeSchedule(ScheduleSpec schedule) {
        if (schedule == null || schedule.isEmpty()) {
            return null;
        }
        
        JobRecurrenceSchedule payload = new JobRecurrenceSchedule();
        payload.setMinutes(SetKeys.toListOrNull(schedule.minutes()));
        payload.setHours(SetKeys.toListOrNull(schedule.hours()));
        payload.setWeekDays(SetKeys.toListOrNull(schedule.weekDays()));
        payload.setMonthDays(SetKeys.toListOrNull(schedule.monthDays()));
        
        List<MonthlyOccurrenceSpec> occurrences = SetKeys.toListOrNull(schedule.monthlyOccurrences());
        if (occurrences != null) {
            payload.setMonthlyOccurrences(occurrences.stream()
                .map(o -> new MonthlyOccurrence(o.day(), o.occurrence()))
                .collect(Collectors.toList()));
        }
        return payload;
    }
    
    public static RecurrenceSpec decode(JobRecurrence payload) {
        return new RecurrenceSpec(
            payload.getFrequency(),
            payload.getInterval(),
            payload.getCount(),
            payload.getEndTime(),
            decodeSchedule(payload.getSchedule()));
    }
    
    static ScheduleSpec decodeSchedule(JobRecurrenceSchedule payload) {
        if (payload == null) {
            return null;
        }
        
        List<MonthlyOccurrenceSpec> occurrences = payload.getMonthlyOccurrences() == null
            ? List.of()
            : payload.getMonthlyOccurrences().stream()
                .map(o -> new MonthlyOccurrenceSpec(o.getDay(), o.getOccurrence()))
                .collect(Collectors.toList());
        
        return new ScheduleSpec(
            SetKeys.intSet(payload.getMinutes()),
            SetKeys.intSet(payload.getHours()),
            SetKeys.stringSetIgnoreCase(payload.getWeekDays()),
            SetKeys.intSet(payload.getMonthDays()),
            SetKeys.monthlyOccurrenceSet(occurrences));
    }
}
