package org.dbms.dsource;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/** Keeps the Arrow Dataset decoder behind the file sources. */
@AnalyzeClasses(packages = "org.dbms.dsource", importOptions = ImportOption.DoNotIncludeTests.class)
public class DsourceEncapsulationTest {

  @ArchTest
  static final ArchRule datasetAccessIsConfined =
      noClasses()
          .that()
          .resideInAPackage("org.dbms.dsource..")
          .and()
          .doNotHaveSimpleName("DatasetFiles")
          .and()
          .doNotHaveSimpleName("CsvDataSource")
          .and()
          .doNotHaveSimpleName("ParquetDataSource")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("org.apache.arrow.dataset..")
          .because("only the file sources may talk to the native decoder");

  @ArchTest
  static final ArchRule decoderBridgeIsPackagePrivate =
      classes()
          .that()
          .haveSimpleNameStartingWith("Dataset")
          .or()
          .haveSimpleName("ProjectionMask")
          .should()
          .notBePublic();

  @ArchTest
  static final ArchRule configIsPlainData =
      noClasses()
          .that()
          .resideInAPackage("org.dbms.dsource.config..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("org.apache.arrow..", "org.dbms.dtype..");
}
