package com.phillippitts.insightbot.service.settings;

import org.springframework.data.jpa.repository.JpaRepository;

public interface GuildSettingsRepository extends JpaRepository<GuildSettingsEntity, Long> {
}
