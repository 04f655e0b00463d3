package com.example.roster.schedule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface ShiftAssignmentRepository extends JpaRepository<ShiftAssignment, Long> {

    /**
     * 指定日付範囲のシフト割り当てを従業員・プロジェクト込みで取得
     */
    @Query("SELECT sa FROM ShiftAssignment sa JOIN FETCH sa.employee JOIN FETCH sa.project " +
           "WHERE sa.workDate BETWEEN :startDate AND :endDate " +
           "ORDER BY sa.workDate, sa.id")
    List<ShiftAssignment> findDetailedBetween(@Param("startDate") LocalDate startDate,
                                              @Param("endDate") LocalDate endDate);

    /**
     * 指定プロジェクトの指定日付範囲のシフト割り当てを取得
     */
    @Query("SELECT sa FROM ShiftAssignment sa JOIN FETCH sa.employee JOIN FETCH sa.project " +
           "WHERE sa.project.id = :projectId AND sa.workDate BETWEEN :startDate AND :endDate " +
           "ORDER BY sa.workDate, sa.id")
    List<ShiftAssignment> findDetailedByProjectBetween(@Param("projectId") Long projectId,
                                                       @Param("startDate") LocalDate startDate,
                                                       @Param("endDate") LocalDate endDate);

    /**
     * 指定従業員の指定日付範囲のシフト割り当てを取得
     */
    @Query("SELECT sa FROM ShiftAssignment sa JOIN FETCH sa.employee JOIN FETCH sa.project " +
           "WHERE sa.employee.id = :employeeId AND sa.workDate BETWEEN :startDate AND :endDate " +
           "ORDER BY sa.workDate, sa.id")
    List<ShiftAssignment> findDetailedByEmployeeBetween(@Param("employeeId") Long employeeId,
                                                        @Param("startDate") LocalDate startDate,
                                                        @Param("endDate") LocalDate endDate);

    boolean existsByEmployee_Id(Long employeeId);

    boolean existsByProject_Id(Long projectId);
}
