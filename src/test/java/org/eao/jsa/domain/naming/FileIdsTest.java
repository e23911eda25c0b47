package org.eao.jsa.domain.naming;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class FileIdsTest {

  @Test
  void fileIdDropsDirectoryCompressionAndExtension() {
    assertEquals("jcmts20140322_00034_850_reduced_001",
        FileIds.fileIdOf("/data/jsa/jcmts20140322_00034_850_reduced_001.sdf.gz"));
    assertEquals("a20130403_00051_01_0001", FileIds.fileIdOf("a20130403_00051_01_0001.sdf"));
    assertEquals("jcmth20130403_00051_02_cube001_obs_000",
        FileIds.fileIdOf("ad:JCMT/jcmth20130403_00051_02_cube001_obs_000"));
  }

  @Test
  void versionedSplitsThreeDigitSuffix() {
    Optional<FileIds.Versioned> versioned = FileIds.versioned("jcmts20140322_00034_850_reduced_012");

    assertTrue(versioned.isPresent());
    assertEquals("jcmts20140322_00034_850_reduced", versioned.get().baseName());
    assertEquals(12, versioned.get().version());
  }

  @Test
  void unversionedIdHasNoVersion() {
    assertTrue(FileIds.versioned("jcmts20140322_00034_850_reduced").isEmpty());
    assertTrue(FileIds.versioned("jcmts20140322_00034_850_reduced_01").isEmpty());
  }
}
