package com.example.roster.employee;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface EmployeeRepository extends JpaRepository<Employee, Long> {

    /**
     * 氏名で従業員を取得
     */
    Optional<Employee> findByName(String name);

    /**
     * ID順の従業員一覧を取得
     */
    List<Employee> findAllByOrderByIdAsc();

    /**
     * 有効な従業員をID順に取得
     */
    List<Employee> findByActiveTrueOrderByIdAsc();
}
