package org.dbms.dtype;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/** Keeps the data model free of I/O concerns and its Arrow accessors internal. */
@AnalyzeClasses(packages = "org.dbms.dtype", importOptions = ImportOption.DoNotIncludeTests.class)
public class DtypeLayeringTest {

  @ArchTest
  static final ArchRule dataModelDoesNotDependOnSources =
      noClasses()
          .that()
          .resideInAPackage("org.dbms.dtype..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("org.dbms.dsource..", "org.apache.arrow.dataset..")
          .because("the data model must not know how batches are produced");

  @ArchTest
  static final ArchRule vectorAccessIsInternal =
      classes()
          .that()
          .haveSimpleName("ArrowValues")
          .should()
          .notBePublic()
          .because("typed vector access is an implementation detail of Column");

  @ArchTest
  static final ArchRule exceptionsAreUnchecked =
      classes()
          .that()
          .haveSimpleNameEndingWith("Exception")
          .should()
          .beAssignableTo(DbmsException.class);
}
