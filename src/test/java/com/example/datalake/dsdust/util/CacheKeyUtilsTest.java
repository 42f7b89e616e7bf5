package com.example.datalake.dsdust.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.dsdust.model.ExpandedQuery;
import com.example.datalake.dsdust.model.IntentKind;
import org.junit.jupiter.api.Test;

class CacheKeyUtilsTest {

  @Test
  void normalizeKeyCollapsesCaseAndWhitespace() {
    assertThat(CacheKeyUtils.normalizeKey("  Finance   DATA ")).isEqualTo("finance data");
    assertThat(CacheKeyUtils.normalizeKey("   ")).isNull();
    assertThat(CacheKeyUtils.normalizeKey(null)).isNull();
  }

  @Test
  void keyDistinguishesFileTypeAndPaging() {
    ExpandedQuery keyword = new ExpandedQuery(IntentKind.KEYWORD, "Finance", null, "Finance", "keyword:Finance");
    ExpandedQuery csv = new ExpandedQuery(IntentKind.FILE_TYPE, "", "csv", "csv", "file_type:csv");

    assertThat(CacheKeyUtils.buildKey(keyword, 1, 0)).isEqualTo("finance::filetype=*::pages=1::files=0");
    assertThat(CacheKeyUtils.buildKey(csv, 0, -1)).isEqualTo("::filetype=csv::pages=0::files=-1");
    assertThat(CacheKeyUtils.buildKey(keyword, 1, 0)).isNotEqualTo(CacheKeyUtils.buildKey(keyword, 2, 0));
  }
}
