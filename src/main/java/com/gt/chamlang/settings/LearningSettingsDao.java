package com.gt.chamlang.settings;

import com.gt.chamlang.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
public class LearningSettingsDao {

    private static final Logger log = LoggerFactory.getLogger(LearningSettingsDao.class);

    private final NamedParameterJdbcTemplate template;

    @Autowired
    public LearningSettingsDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    private static final String UPSERT_SETTING_ROW =
            "INSERT INTO learning_settings (setting_name, setting_value) " +
            "VALUES (:settingName, :settingValue) " +
            "ON CONFLICT (setting_name) DO UPDATE " +
                    "SET setting_value = :settingValue";

    private static final String GET_SETTINGS =
            "SELECT setting_name, setting_value " +
            "FROM learning_settings";

    public void saveSettings(Map<String, String> settings) {
        int index = 0;
        SqlParameterSource[] sources = new SqlParameterSource[settings.size()];

        for(Map.Entry<String, String> settingVal : settings.entrySet()) {
            MapSqlParameterSource source = new MapSqlParameterSource();
            source.addValue("settingName", settingVal.getKey());
            source.addValue("settingValue", settingVal.getValue());

            sources[index++] = source;
        }

        try {
            template.batchUpdate(UPSERT_SETTING_ROW, sources);
        } catch (DataAccessException ex) {
            String errMsg = "Unable to save learning settings";
            log.error(errMsg, ex);
            throw new StoreUnavailableException(errMsg, ex);
        }
    }

    public Map<String, String> getSettings() {
        try {
            return template.query(GET_SETTINGS, Map.of(), (rs) -> {
                Map<String, String> settings = new HashMap<>();

                while(rs.next()) {
                    String settingName = rs.getString("setting_name");
                    String settingValue = rs.getString("setting_value");

                    if (settingName != null && !settingName.isBlank() && settingValue != null && !settingValue.isBlank()) {
                        settings.put(settingName, settingValue);
                    }
                }

                return settings;
            });
        } catch (DataAccessException ex) {
            String errMsg = "Unable to load learning settings";
            log.error(errMsg, ex);
            throw new StoreUnavailableException(errMsg, ex);
        }
    }
}
