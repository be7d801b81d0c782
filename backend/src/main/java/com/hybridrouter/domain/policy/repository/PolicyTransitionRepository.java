package com.hybridrouter.domain.policy.repository;

import com.hybridrouter.domain.policy.model.PolicyTransition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PolicyTransitionRepository extends JpaRepository<PolicyTransition, Long> {

    Optional<PolicyTransition> findTopByOrderByCreatedAtDescIdDesc();
}
