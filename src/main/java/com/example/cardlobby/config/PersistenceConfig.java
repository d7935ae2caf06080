package com.example.cardlobby.config;

import com.example.cardlobby.persistence.InMemoryPersistentRooms;
import com.example.cardlobby.persistence.JpaPersistentRooms;
import com.example.cardlobby.persistence.PersistentRooms;
import com.example.cardlobby.repository.PersistedRoomRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class PersistenceConfig {

  @Bean
  @ConditionalOnProperty(prefix = "lobby.persistence", name = "mode", havingValue = "jpa")
  public PersistentRooms persistentRoomsJpa(PersistedRoomRepository repo, PlatformTransactionManager txManager) {
    return new JpaPersistentRooms(repo, new TransactionTemplate(txManager));
  }

  // Fallback without database: process-local records
  @Bean
  @ConditionalOnMissingBean(PersistentRooms.class)
  public PersistentRooms persistentRoomsInMemory() {
    return new InMemoryPersistentRooms();
  }
}
