package architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * 모듈 의존 방향 검증
 *
 * <pre>
 * module-app      (컨트롤러, 엔진 서비스, AOP)
 *     ↓
 * module-infra    (JPA 어댑터, 원장, 락, 실행기)
 *     ↓
 * module-core     (Port, 도메인 모델, 계산기)
 *     ↓
 * module-common   (에러 코드, 예외 계층, 응답 포맷)
 * </pre>
 */
@DisplayName("Module Dependency Enforcement")
class ModuleDependencyTest {

  private static final String[] ENGINES = {
    "estate.token.service.market..",
    "estate.token.service.rental..",
    "estate.token.service.auction..",
    "estate.token.service.delegation..",
    "estate.token.service.title.."
  };

  private final JavaClasses classes =
      new ClassFileImporter()
          .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
          .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_JARS)
          .importPackages("estate.token");

  @Nested
  @DisplayName("Dependency Direction: app → infra → core → common")
  class DependencyDirectionTests {

    @Test
    @DisplayName("module-infra는 app 계층(service, controller, aop)에 의존하지 않는다")
    void infraMustNotDependOnApp() {
      noClasses()
          .that()
          .resideInAPackage("estate.token.infrastructure..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "estate.token.service..", "estate.token.controller..", "estate.token.aop..")
          .because("Infrastructure implements core ports and must not reach back into services")
          .check(classes);
    }

    @Test
    @DisplayName("module-core는 infra/app에 의존하지 않는다")
    void coreMustNotDependOnInfraOrApp() {
      noClasses()
          .that()
          .resideInAnyPackage("estate.token.core..", "estate.token.domain..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "estate.token.infrastructure..",
              "estate.token.service..",
              "estate.token.controller..")
          .because("Core defines ports and pure domain models only")
          .check(classes);
    }

    @Test
    @DisplayName("module-core 도메인 모델은 Spring/JPA에 의존하지 않는다")
    void domainIsFrameworkFree() {
      noClasses()
          .that()
          .resideInAPackage("estate.token.domain..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("org.springframework..", "jakarta.persistence..")
          .check(classes);
    }

    @Test
    @DisplayName("module-common은 상위 모듈에 의존하지 않는다")
    void commonMustNotDependOnOtherModules() {
      noClasses()
          .that()
          .resideInAnyPackage(
              "estate.token.common..", "estate.token.error..", "estate.token.response..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "estate.token.core..",
              "estate.token.domain..",
              "estate.token.infrastructure..",
              "estate.token.service..")
          .check(classes);
    }
  }

  @Nested
  @DisplayName("Package Ownership")
  class PackageOwnershipTests {

    @Test
    @DisplayName("Repository는 infrastructure.persistence에만 존재한다")
    void repositoriesShouldBeInInfrastructure() {
      classes()
          .that()
          .haveSimpleNameEndingWith("Repository")
          .should()
          .resideInAPackage("estate.token.infrastructure.persistence..")
          .check(classes);
    }

    @Test
    @DisplayName("엔진 서비스는 서로를 직접 호출하지 않는다 (레지스트리를 통해서만 상태 공유)")
    void enginesDoNotCallEachOther() {
      for (String engine : ENGINES) {
        String[] others =
            Arrays.stream(ENGINES).filter(other -> !other.equals(engine)).toArray(String[]::new);
        noClasses()
            .that()
            .resideInAPackage(engine)
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(others)
            .check(classes);
      }
    }

    @Test
    @DisplayName("Controller는 controller 패키지에만 존재한다")
    void controllersShouldBeInControllerPackage() {
      classes()
          .that()
          .haveSimpleNameEndingWith("Controller")
          .should()
          .resideInAPackage("estate.token.controller..")
          .check(classes);
    }
  }
}
