package com.example.roster.config;

import com.example.roster.costing.CostSummarizer;
import com.example.roster.engine.AssignmentEngine;
import com.example.roster.engine.SchedulingPolicy;
import com.example.roster.engine.ShiftCatalog;
import com.example.roster.engine.ShiftTemplate;
import com.example.roster.engine.ShiftType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;

@Configuration
public class SchedulingConfig {

    private static final Logger logger = LoggerFactory.getLogger(SchedulingConfig.class);

    @Value("${roster.shift.morning.start:06:00}")
    private String morningStart;

    @Value("${roster.shift.morning.end:14:00}")
    private String morningEnd;

    @Value("${roster.shift.afternoon.start:14:00}")
    private String afternoonStart;

    @Value("${roster.shift.afternoon.end:22:00}")
    private String afternoonEnd;

    @Value("${roster.shift.night.start:22:00}")
    private String nightStart;

    @Value("${roster.shift.night.end:06:00}")
    private String nightEnd;

    @Value("${roster.engine.preferred-bonus:2}")
    private int preferredBonus;

    @Value("${roster.engine.avoidance-penalty:2}")
    private int avoidancePenalty;

    @Value("${roster.engine.near-cap-penalty:1}")
    private int nearCapPenalty;

    @Value("${roster.engine.weekly-hour-cap:40}")
    private int weeklyHourCap;

    @Value("${roster.engine.max-shifts-per-day:0}")
    private int maxShiftsPerDay;

    @Value("${roster.engine.week-start:SUNDAY}")
    private DayOfWeek weekStart;

    /**
     * シフト種別ごとの時間帯。各シフトは0時間より長く16時間以内であること。
     */
    @Bean
    public ShiftCatalog shiftCatalog() {
        ShiftCatalog catalog = ShiftCatalog.of(List.of(
                new ShiftTemplate(ShiftType.MORNING, LocalTime.parse(morningStart), LocalTime.parse(morningEnd)),
                new ShiftTemplate(ShiftType.AFTERNOON, LocalTime.parse(afternoonStart), LocalTime.parse(afternoonEnd)),
                new ShiftTemplate(ShiftType.NIGHT, LocalTime.parse(nightStart), LocalTime.parse(nightEnd))));
        catalog.templates().values().forEach(t ->
                logger.info("シフト時間帯: {} {}-{}", t.type().getKey(), t.start(), t.end()));
        return catalog;
    }

    @Bean
    public SchedulingPolicy schedulingPolicy() {
        return new SchedulingPolicy(preferredBonus, avoidancePenalty, nearCapPenalty,
                weeklyHourCap, maxShiftsPerDay, weekStart);
    }

    @Bean
    public AssignmentEngine assignmentEngine(ShiftCatalog shiftCatalog, SchedulingPolicy schedulingPolicy) {
        return new AssignmentEngine(shiftCatalog, schedulingPolicy);
    }

    @Bean
    public CostSummarizer costSummarizer(ShiftCatalog shiftCatalog) {
        return new CostSummarizer(shiftCatalog);
    }
}
