package com.example.roster.constraint;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface EmployeeConstraintRepository extends JpaRepository<EmployeeConstraint, Long> {

    /**
     * 指定された従業員の有効な制約を取得
     */
    List<EmployeeConstraint> findByEmployee_IdAndActiveTrueOrderByIdAsc(Long employeeId);

    /**
     * 指定された従業員群の有効な制約を取得
     */
    List<EmployeeConstraint> findByEmployee_IdInAndActiveTrue(Collection<Long> employeeIds);

    /**
     * 指定された従業員の制約を全て削除
     */
    void deleteByEmployee_Id(Long employeeId);
}
