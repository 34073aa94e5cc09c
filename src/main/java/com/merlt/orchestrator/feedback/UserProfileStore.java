package com.merlt.orchestrator.feedback;

import com.merlt.orchestrator.model.UserProfile;
import java.util.Optional;

public interface UserProfileStore {

    Optional<UserProfile> findProfile(String userId);
}
