package com.incidents.stats.repository.readonly;

import com.incidents.stats.model.readonly.AppSettingDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AppSettingReadRepository extends MongoRepository<AppSettingDocument, String> {
}
