package com.apunto.roster.repository;

import com.apunto.roster.entity.UserEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<UserEntity, UUID> {

    Optional<UserEntity> findByBattlenetId(Long battlenetId);
}
