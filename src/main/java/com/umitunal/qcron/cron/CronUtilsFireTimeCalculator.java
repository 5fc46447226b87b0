package com.umitunal.qcron.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.umitunal.qcron.core.FireTimeCalculator;
import com.umitunal.qcron.exception.InvalidCronSpecException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * FireTimeCalculator built on cron-utils.
 *
 * <pre>
 *  *  *  *  *  *  *
 *  ┬  ┬  ┬  ┬  ┬  ┬
 *  │  │  │  │  │  └── day of week (0 - 7) (0 or 7 is Sun)
 *  │  │  │  │  └───── month (1 - 12)
 *  │  │  │  └──────── day of month (1 - 31)
 *  │  │  └─────────── hour (0 - 23)
 *  │  └────────────── minute (0 - 59)
 *  └───────────────── second (0 - 59, optional)
 * </pre>
 *
 * Five-field expressions follow unix crontab; six-field expressions are the same grammar with a
 * leading seconds field.
 */
public class CronUtilsFireTimeCalculator implements FireTimeCalculator {
    private static final CronParser UNIX = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser WITH_SECONDS = new CronParser(unixWithSeconds());

    private final ZoneId zone;
    private final Map<String, ExecutionTime> cache = new ConcurrentHashMap<>();

    public CronUtilsFireTimeCalculator() {
        this(ZoneOffset.UTC);
    }

    public CronUtilsFireTimeCalculator(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public void validate(String cronspec) {
        executionTime(cronspec);
    }

    @Override
    public Instant nextFireTime(String cronspec, Instant after) {
        ZonedDateTime base = ZonedDateTime.ofInstant(after, zone);
        return executionTime(cronspec).nextExecution(base)
                .map(ZonedDateTime::toInstant)
                .orElseThrow(() -> new InvalidCronSpecException(cronspec));
    }

    private ExecutionTime executionTime(String cronspec) {
        if (cronspec == null) {
            throw new InvalidCronSpecException("null");
        }
        ExecutionTime cached = cache.get(cronspec);
        if (cached != null) {
            return cached;
        }
        ExecutionTime parsed = ExecutionTime.forCron(parse(cronspec));
        cache.putIfAbsent(cronspec, parsed);
        return parsed;
    }

    private static CronDefinition unixWithSeconds() {
        return CronDefinitionBuilder.defineCron()
                .withSeconds().withValidRange(0, 59).and()
                .withMinutes().withValidRange(0, 59).and()
                .withHours().withValidRange(0, 23).and()
                .withDayOfMonth().withValidRange(1, 31).and()
                .withMonth().withValidRange(1, 12).and()
                .withDayOfWeek().withMondayDoWValue(1).withValidRange(0, 7).withIntMapping(7, 0).and()
                .matchDayOfWeekAndDayOfMonth()
                .instance();
    }

    private static Cron parse(String cronspec) {
        String expr = cronspec.trim();
        CronParser parser;
        switch (expr.split("\\s+").length) {
            case 5:
                parser = UNIX;
                break;
            case 6:
                parser = WITH_SECONDS;
                break;
            default:
                throw new InvalidCronSpecException(cronspec);
        }
        try {
            Cron cron = parser.parse(expr);
            cron.validate();
            return cron;
        } catch (IllegalArgumentException e) {
            throw new InvalidCronSpecException(cronspec, e);
        }
    }
}
