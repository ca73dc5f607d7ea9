package com.incidents.adapter.repository;

import com.incidents.adapter.model.AppSetting;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface AppSettingRepository extends MongoRepository<AppSetting, String> {
}
