package com.example.datalake.dsdust.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FileInfoTest {

  @Test
  void extensionIsLowercasedAfterTheLastDot() {
    assertThat(new FileInfo("archive.tar.GZ", 1L).extension()).isEqualTo("gz");
    assertThat(new FileInfo(" ledger.CSV ", 1L).extension()).isEqualTo("csv");
  }

  @Test
  void namesWithoutADotHaveNoExtension() {
    assertThat(new FileInfo("README", 1L).extension()).isEmpty();
    assertThat(new FileInfo("  ", 1L).extension()).isEmpty();
    assertThat(new FileInfo(null, 1L).extension()).isEmpty();
  }
}
