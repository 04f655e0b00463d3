package com.example.roster.project;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProjectRepository extends JpaRepository<Project, Long> {

    /**
     * 名称でプロジェクトを取得
     */
    Optional<Project> findByName(String name);

    /**
     * ID順のプロジェクト一覧を取得
     */
    List<Project> findAllByOrderByIdAsc();

    /**
     * 必要人数定義を含めて全プロジェクトを取得（スケジュール計算用）
     */
    @Query("SELECT DISTINCT p FROM Project p LEFT JOIN FETCH p.requirements ORDER BY p.id")
    List<Project> findAllWithRequirements();
}
