package com.bastion.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import com.bastion.security.UserDirectory;
import com.bastion.security.UserFilter;
import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

@DisplayName("UserStoreConfig")
class UserStoreConfigTest {

    private final ApplicationContextRunner runner =
            new ApplicationContextRunner()
                    .withUserConfiguration(UserStoreConfig.class)
                    .withPropertyValues(
                            "bastion.database.url=jdbc:h2:mem:cfg-"
                                    + UUID.randomUUID()
                                    + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
                            "bastion.database.username=sa");

    @Test
    @DisplayName("migrates on startup and exposes a working user directory")
    void migratesAndWiresDirectory() {
        runner.run(
                context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasBean(UserStoreConfig.USER_STORE_FLYWAY_BEAN);

                    Flyway flyway = context.getBean(Flyway.class);
                    assertThat(flyway.info().current()).isNotNull();
                    assertThat(flyway.info().current().getVersion().getVersion()).isEqualTo("1");

                    UserDirectory directory = context.getBean(UserDirectory.class);
                    directory.insert("wired@x.com", "d1");
                    assertThat(directory.findOne(UserFilter.byEmail("wired@x.com"))).isPresent();
                });
    }

    @Test
    @DisplayName("fails fast when the url is missing")
    void failsWithoutUrl() {
        new ApplicationContextRunner()
                .withUserConfiguration(UserStoreConfig.class)
                .withPropertyValues("bastion.database.username=sa")
                .run(context -> assertThat(context).hasFailed());
    }

    @Nested
    @DisplayName("DatabaseProperties defaults")
    class Defaults {

        @Test
        @DisplayName("applies defaults for optional fields")
        void appliesDefaults() {
            var props = new DatabaseProperties("jdbc:h2:mem:x", "sa", null, null, null);

            assertThat(props.password()).isEmpty();
            assertThat(props.locations()).isEqualTo(DatabaseProperties.DEFAULT_LOCATIONS);
            assertThat(props.migrateOnStartup()).isTrue();
        }

        @Test
        @DisplayName("keeps explicit values")
        void keepsExplicitValues() {
            var props =
                    new DatabaseProperties(
                            "jdbc:postgresql://db/bastion", "bastion", "pw", "classpath:db/other", false);

            assertThat(props.locations()).isEqualTo("classpath:db/other");
            assertThat(props.migrateOnStartup()).isFalse();
        }
    }
}
