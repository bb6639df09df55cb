package linkguard;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
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
                .importPackages("linkguard");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapters, filters or configuration")
        void coreShouldStayIndependent() {
            noClasses()
                    .that()
                    .resideInAPackage("linkguard.core..")
                    .should()
                    .dependOnClassesThat()
                    .resideInAnyPackage("linkguard.adapter..", "linkguard.system..", "linkguard.config..")
                    .check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on Quarkus or Redis")
        void coreShouldNotDependOnFrameworks() {
            noClasses()
                    .that()
                    .resideInAPackage("linkguard.core..")
                    .should()
                    .dependOnClassesThat()
                    .resideInAnyPackage("io.quarkus..", "io.vertx..", "jakarta.ws.rs..")
                    .check(importedClasses);
        }
    }

    @Test
    @DisplayName("Adapters should not depend on system filters")
    void adapterShouldNotDependOnSystem() {
        noClasses()
                .that()
                .resideInAPackage("linkguard.adapter..")
                .should()
                .dependOnClassesThat()
                .resideInAPackage("linkguard.system..")
                .check(importedClasses);
    }

    @Test
    @DisplayName("SPI should only expose core ports")
    void spiShouldNotDependOnAdapters() {
        noClasses()
                .that()
                .resideInAPackage("linkguard.spi..")
                .should()
                .dependOnClassesThat()
                .resideInAnyPackage("linkguard.adapter..", "linkguard.system..")
                .check(importedClasses);
    }
}
