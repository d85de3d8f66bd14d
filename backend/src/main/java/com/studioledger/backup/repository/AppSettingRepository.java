package com.studioledger.backup.repository;

import com.studioledger.backup.model.entity.AppSetting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AppSettingRepository extends JpaRepository<AppSetting, String> {

    List<AppSetting> findByKeyIn(Collection<String> keys);
}
