package warden;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Hexagonal Architecture Rules")
class HexagonalArchitectureTest {

    private static JavaClasses importedClasses;

    @BeforeAll
    static void setUp() {
        importedClasses = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("warden");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapter")
        void coreShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that()
                    .resideInAPackage("warden.core..")
                    .should()
                    .dependOnClassesThat()
                    .resideInAPackage("warden.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core model should not depend on services")
        void modelShouldNotDependOnServices() {
            ArchRule rule = noClasses()
                    .that()
                    .resideInAPackage("warden.core.model..")
                    .should()
                    .dependOnClassesThat()
                    .resideInAPackage("warden.core.service..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not touch crypto or Micrometer libraries")
        void coreShouldNotTouchInfrastructureLibraries() {
            ArchRule rule = noClasses()
                    .that()
                    .resideInAPackage("warden.core..")
                    .should()
                    .dependOnClassesThat()
                    .resideInAnyPackage("org.jose4j..", "org.wildfly.security..", "io.micrometer..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("SPI Rules")
    class SpiRules {

        @Test
        @DisplayName("SPI should not depend on adapter")
        void spiShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that()
                    .resideInAPackage("warden.spi..")
                    .should()
                    .dependOnClassesThat()
                    .resideInAPackage("warden.adapter..");

            rule.check(importedClasses);
        }
    }
}
