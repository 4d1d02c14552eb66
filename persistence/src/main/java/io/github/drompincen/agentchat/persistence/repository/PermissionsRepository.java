package io.github.drompincen.agentchat.persistence.repository;

import io.github.drompincen.agentchat.persistence.document.PermissionsDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface PermissionsRepository extends MongoRepository<PermissionsDocument, String> {
}
